package com.tencent.taskboard.infrastructure.persistence.workflow.entity;

import lombok.Data;

/**
 * RuleMetricsDO - 单条规则的评估统计
 *
 * @author taskboard
 */
@Data
public class RuleMetricsDO {

    private Long ruleId;

    private String ruleName;

    private Long evaluated;

    private Long applied;

    private Long suppressed;

    private Long suppressedIdempotent;

    private Long suppressedNotUserTriggered;

    private Long suppressedNotMatching;

    private Long suppressedInactive;
}
