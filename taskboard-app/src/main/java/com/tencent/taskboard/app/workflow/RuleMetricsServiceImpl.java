package com.tencent.taskboard.app.workflow;

import com.tencent.taskboard.app.common.FacadeTemplate;
import com.tencent.taskboard.app.workflow.executor.query.RuleExecutionPageQryExe;
import com.tencent.taskboard.app.workflow.executor.query.RuleMetricsQryExe;
import com.tencent.taskboard.client.api.RuleMetricsServiceI;
import com.tencent.taskboard.client.dto.MultiResponse;
import com.tencent.taskboard.client.dto.PageResponse;
import com.tencent.taskboard.client.dto.SingleResponse;
import com.tencent.taskboard.client.dto.command.RuleExecutionPageQry;
import com.tencent.taskboard.client.dto.command.RuleMetricsQry;
import com.tencent.taskboard.client.dto.data.RuleExecutionDTO;
import com.tencent.taskboard.client.dto.data.RuleMetricsDTO;
import com.tencent.taskboard.client.dto.data.WorkflowMetricsDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RuleMetricsServiceImpl implements RuleMetricsServiceI {

    private final FacadeTemplate facadeTemplate;
    private final RuleMetricsQryExe ruleMetricsQryExe;
    private final RuleExecutionPageQryExe ruleExecutionPageQryExe;

    @Override
    public SingleResponse<RuleMetricsDTO> ruleMetrics(RuleMetricsQry qry) {
        return facadeTemplate.execute(qry, () -> ruleMetricsQryExe.ruleMetrics(qry), SingleResponse::buildFailureWith);
    }

    @Override
    public MultiResponse<WorkflowMetricsDTO> projectSummary(RuleMetricsQry qry) {
        return facadeTemplate.execute(qry, () -> ruleMetricsQryExe.projectSummary(qry), MultiResponse::buildFailureWith);
    }

    @Override
    public PageResponse<RuleExecutionDTO> executions(RuleExecutionPageQry qry) {
        return facadeTemplate.execute(qry, () -> ruleExecutionPageQryExe.execute(qry), PageResponse::buildFailureWith);
    }
}
