package com.tencent.taskboard.infrastructure.persistence.workflow.entity;

import lombok.Data;

/**
 * WorkflowMetricsDO - 工作流维度的评估汇总
 *
 * @author taskboard
 */
@Data
public class WorkflowMetricsDO {

    private Long workflowId;

    private String workflowName;

    private Long ruleCount;

    private Long evaluated;

    private Long applied;

    private Long suppressed;
}
