package com.tencent.taskboard.client.dto.data;

import lombok.Data;

@Data
public class WorkflowMetricsDTO {
    private Long workflowId;
    private String workflowName;
    private long ruleCount;
    private long evaluatedCount;
    private long appliedCount;
    private long suppressedCount;
}
