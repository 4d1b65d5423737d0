package com.tencent.taskboard.domain.workflow;

import lombok.Builder;
import lombok.Value;

/**
 * RuleMetrics - 单条规则在时间窗口内的评估统计
 *
 * @author taskboard
 */
@Value
@Builder
public class RuleMetrics {

    Long ruleId;

    String ruleName;

    long evaluated;

    long applied;

    long suppressed;

    long suppressedIdempotent;

    long suppressedNotUserTriggered;

    long suppressedNotMatching;

    long suppressedInactive;
}
