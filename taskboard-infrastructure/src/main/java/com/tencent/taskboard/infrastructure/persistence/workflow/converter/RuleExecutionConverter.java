package com.tencent.taskboard.infrastructure.persistence.workflow.converter;

import com.tencent.taskboard.domain.workflow.ExecutionOutcome;
import com.tencent.taskboard.domain.workflow.ResourceType;
import com.tencent.taskboard.domain.workflow.RuleExecution;
import com.tencent.taskboard.domain.workflow.RuleMetrics;
import com.tencent.taskboard.domain.workflow.SuppressionReason;
import com.tencent.taskboard.domain.workflow.WorkflowMetrics;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.RuleExecutionDO;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.RuleExecutionViewDO;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.RuleMetricsDO;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.WorkflowMetricsDO;

/**
 * RuleExecutionConverter - 评估记录及统计转换器
 *
 * @author taskboard
 */
public class RuleExecutionConverter {

    public static RuleExecutionDO toDataObject(RuleExecution domain) {
        RuleExecutionDO dataObject = new RuleExecutionDO();
        dataObject.setRuleId(domain.getRuleId());
        dataObject.setOriginType(domain.getOriginType().getCode());
        dataObject.setOriginId(domain.getOriginId());
        dataObject.setOutcome(domain.getOutcome().getCode());
        dataObject.setSuppressionReason(
            domain.getSuppressionReason() != null ? domain.getSuppressionReason().getCode() : null);
        dataObject.setUserId(domain.getUserId());
        dataObject.setCreatedAt(domain.getCreatedAt());
        return dataObject;
    }

    public static RuleExecution toDomain(RuleExecutionDO dataObject) {
        if (dataObject == null) {
            return null;
        }

        RuleExecution.RuleExecutionBuilder builder = RuleExecution.builder()
            .id(dataObject.getId())
            .ruleId(dataObject.getRuleId())
            .originType(ResourceType.fromCode(dataObject.getOriginType()))
            .originId(dataObject.getOriginId())
            .outcome(ExecutionOutcome.fromCode(dataObject.getOutcome()))
            .suppressionReason(dataObject.getSuppressionReason() != null
                ? SuppressionReason.fromCode(dataObject.getSuppressionReason()) : null)
            .userId(dataObject.getUserId())
            .createdAt(dataObject.getCreatedAt());
        if (dataObject instanceof RuleExecutionViewDO) {
            builder.userEmail(((RuleExecutionViewDO) dataObject).getUserEmail());
        }
        return builder.build();
    }

    public static RuleMetrics metricsToDomain(RuleMetricsDO dataObject) {
        return RuleMetrics.builder()
            .ruleId(dataObject.getRuleId())
            .ruleName(dataObject.getRuleName())
            .evaluated(count(dataObject.getEvaluated()))
            .applied(count(dataObject.getApplied()))
            .suppressed(count(dataObject.getSuppressed()))
            .suppressedIdempotent(count(dataObject.getSuppressedIdempotent()))
            .suppressedNotUserTriggered(count(dataObject.getSuppressedNotUserTriggered()))
            .suppressedNotMatching(count(dataObject.getSuppressedNotMatching()))
            .suppressedInactive(count(dataObject.getSuppressedInactive()))
            .build();
    }

    public static WorkflowMetrics workflowMetricsToDomain(WorkflowMetricsDO dataObject) {
        return WorkflowMetrics.builder()
            .workflowId(dataObject.getWorkflowId())
            .workflowName(dataObject.getWorkflowName())
            .ruleCount(count(dataObject.getRuleCount()))
            .evaluated(count(dataObject.getEvaluated()))
            .applied(count(dataObject.getApplied()))
            .suppressed(count(dataObject.getSuppressed()))
            .build();
    }

    private static long count(Long value) {
        return value == null ? 0L : value;
    }
}
