package com.tencent.taskboard.client.api;

import com.tencent.taskboard.client.dto.MultiResponse;
import com.tencent.taskboard.client.dto.PageResponse;
import com.tencent.taskboard.client.dto.SingleResponse;
import com.tencent.taskboard.client.dto.command.RuleExecutionPageQry;
import com.tencent.taskboard.client.dto.command.RuleMetricsQry;
import com.tencent.taskboard.client.dto.data.RuleExecutionDTO;
import com.tencent.taskboard.client.dto.data.RuleMetricsDTO;
import com.tencent.taskboard.client.dto.data.WorkflowMetricsDTO;

/**
 * 规则执行记录的只读聚合
 */
public interface RuleMetricsServiceI {

    /**
     * @param qry targetId 为规则ID
     */
    SingleResponse<RuleMetricsDTO> ruleMetrics(RuleMetricsQry qry);

    /**
     * @param qry targetId 为项目ID
     */
    MultiResponse<WorkflowMetricsDTO> projectSummary(RuleMetricsQry qry);

    PageResponse<RuleExecutionDTO> executions(RuleExecutionPageQry qry);
}
