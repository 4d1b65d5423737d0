package com.tencent.taskboard.client.dto.data;

import lombok.Data;

@Data
public class RuleMetricsDTO {
    private Long ruleId;
    private String ruleName;
    private long evaluatedCount;
    private long appliedCount;
    private long suppressedCount;
    private long suppressedIdempotent;
    private long suppressedNotUserTriggered;
    private long suppressedNotMatching;
    private long suppressedInactive;
}
