package com.tencent.taskboard.domain.workflow;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * RuleExecution - 规则评估记录，只追加
 *
 * @author taskboard
 */
@Value
@Builder(toBuilder = true)
public class RuleExecution {

    Long id;

    Long ruleId;

    ResourceType originType;

    Long originId;

    ExecutionOutcome outcome;

    /**
     * 仅 outcome = SUPPRESSED 时有值
     */
    SuppressionReason suppressionReason;

    /**
     * 仅用户触发时有值
     */
    Long userId;

    /**
     * 读侧关联出的用户邮箱
     */
    String userEmail;

    Instant createdAt;

    public boolean isApplied() {
        return outcome == ExecutionOutcome.APPLIED;
    }
}
