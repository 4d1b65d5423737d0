package com.tencent.taskboard.app.assembler;

import com.tencent.taskboard.client.dto.data.RuleExecutionDTO;
import com.tencent.taskboard.client.dto.data.RuleMetricsDTO;
import com.tencent.taskboard.client.dto.data.WorkflowMetricsDTO;
import com.tencent.taskboard.domain.workflow.RuleExecution;
import com.tencent.taskboard.domain.workflow.RuleMetrics;
import com.tencent.taskboard.domain.workflow.WorkflowMetrics;

/**
 * RuleMetricsAssembler - 规则评估统计转 DTO
 *
 * @author taskboard
 */
public class RuleMetricsAssembler {

    public static RuleMetricsDTO toDTO(RuleMetrics metrics) {
        RuleMetricsDTO dto = new RuleMetricsDTO();
        dto.setRuleId(metrics.getRuleId());
        dto.setRuleName(metrics.getRuleName());
        dto.setEvaluatedCount(metrics.getEvaluated());
        dto.setAppliedCount(metrics.getApplied());
        dto.setSuppressedCount(metrics.getSuppressed());
        dto.setSuppressedIdempotent(metrics.getSuppressedIdempotent());
        dto.setSuppressedNotUserTriggered(metrics.getSuppressedNotUserTriggered());
        dto.setSuppressedNotMatching(metrics.getSuppressedNotMatching());
        dto.setSuppressedInactive(metrics.getSuppressedInactive());
        return dto;
    }

    public static WorkflowMetricsDTO toDTO(WorkflowMetrics metrics) {
        WorkflowMetricsDTO dto = new WorkflowMetricsDTO();
        dto.setWorkflowId(metrics.getWorkflowId());
        dto.setWorkflowName(metrics.getWorkflowName());
        dto.setRuleCount(metrics.getRuleCount());
        dto.setEvaluatedCount(metrics.getEvaluated());
        dto.setAppliedCount(metrics.getApplied());
        dto.setSuppressedCount(metrics.getSuppressed());
        return dto;
    }

    public static RuleExecutionDTO toDTO(RuleExecution execution) {
        RuleExecutionDTO dto = new RuleExecutionDTO();
        dto.setId(execution.getId());
        dto.setRuleId(execution.getRuleId());
        dto.setOriginType(execution.getOriginType().getCode());
        dto.setOriginId(execution.getOriginId());
        dto.setOutcome(execution.getOutcome().getCode());
        dto.setSuppressionReason(
            execution.getSuppressionReason() != null ? execution.getSuppressionReason().getCode() : null);
        dto.setUserId(execution.getUserId());
        dto.setUserEmail(execution.getUserEmail());
        dto.setCreatedAt(execution.getCreatedAt());
        return dto;
    }
}
