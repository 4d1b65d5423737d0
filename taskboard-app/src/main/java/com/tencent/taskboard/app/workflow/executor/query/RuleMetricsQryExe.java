package com.tencent.taskboard.app.workflow.executor.query;

import com.tencent.taskboard.app.assembler.RuleMetricsAssembler;
import com.tencent.taskboard.client.dto.ErrorCode;
import com.tencent.taskboard.client.dto.MultiResponse;
import com.tencent.taskboard.client.dto.SingleResponse;
import com.tencent.taskboard.client.dto.command.RuleMetricsQry;
import com.tencent.taskboard.client.dto.data.RuleMetricsDTO;
import com.tencent.taskboard.client.dto.data.WorkflowMetricsDTO;
import com.tencent.taskboard.domain.workflow.repository.RuleExecutionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * RuleMetricsQryExe - 规则与工作流维度的评估统计
 *
 * @author taskboard
 */
@Component
@RequiredArgsConstructor
public class RuleMetricsQryExe {

    private final RuleExecutionRepository ruleExecutionRepository;

    @Transactional(readOnly = true)
    public SingleResponse<RuleMetricsDTO> ruleMetrics(RuleMetricsQry qry) {
        if (qry.getFrom().isAfter(qry.getTo())) {
            return SingleResponse.buildFailureWith(ErrorCode.VALIDATION_ERROR, "from must not be after to");
        }
        return ruleExecutionRepository.metricsForRule(qry.getTargetId(), qry.getFrom(), qry.getTo())
            .map(RuleMetricsAssembler::toDTO)
            .map(SingleResponse::of)
            .orElseGet(() -> SingleResponse.buildFailureWith(ErrorCode.NOT_FOUND,
                "Rule not found: " + qry.getTargetId()));
    }

    @Transactional(readOnly = true)
    public MultiResponse<WorkflowMetricsDTO> projectSummary(RuleMetricsQry qry) {
        if (qry.getFrom().isAfter(qry.getTo())) {
            return MultiResponse.buildFailureWith(ErrorCode.VALIDATION_ERROR, "from must not be after to");
        }
        List<WorkflowMetricsDTO> summary = ruleExecutionRepository
            .metricsForProject(qry.getTargetId(), qry.getFrom(), qry.getTo())
            .stream()
            .map(RuleMetricsAssembler::toDTO)
            .collect(Collectors.toList());
        return MultiResponse.of(summary);
    }
}
