package com.tencent.taskboard.app.workflow.executor.query;

import com.tencent.taskboard.app.assembler.RuleMetricsAssembler;
import com.tencent.taskboard.client.dto.ErrorCode;
import com.tencent.taskboard.client.dto.PageResponse;
import com.tencent.taskboard.client.dto.command.RuleExecutionPageQry;
import com.tencent.taskboard.client.dto.data.RuleExecutionDTO;
import com.tencent.taskboard.domain.workflow.ExecutionPage;
import com.tencent.taskboard.domain.workflow.repository.RuleExecutionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * RuleExecutionPageQryExe - 评估记录明细，按时间倒序
 *
 * @author taskboard
 */
@Component
@RequiredArgsConstructor
public class RuleExecutionPageQryExe {

    private final RuleExecutionRepository ruleExecutionRepository;

    @Transactional(readOnly = true)
    public PageResponse<RuleExecutionDTO> execute(RuleExecutionPageQry qry) {
        if (qry.getFrom().isAfter(qry.getTo())) {
            return PageResponse.buildFailureWith(ErrorCode.VALIDATION_ERROR, "from must not be after to");
        }
        ExecutionPage page = ruleExecutionRepository.page(
            qry.getRuleId(), qry.getFrom(), qry.getTo(), qry.getPageIndex(), qry.getPageSize());
        List<RuleExecutionDTO> records = page.getRecords().stream()
            .map(RuleMetricsAssembler::toDTO)
            .collect(Collectors.toList());
        return PageResponse.of(records, page.getTotal(), page.getPageSize(), page.getPageIndex());
    }
}
