package com.tencent.taskboard.domain.workflow;

import lombok.Builder;
import lombok.Value;

/**
 * WorkflowMetrics - 项目可见工作流的评估汇总
 *
 * @author taskboard
 */
@Value
@Builder
public class WorkflowMetrics {

    Long workflowId;

    String workflowName;

    long ruleCount;

    long evaluated;

    long applied;

    long suppressed;
}
