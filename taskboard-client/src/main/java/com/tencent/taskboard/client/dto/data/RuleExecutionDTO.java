package com.tencent.taskboard.client.dto.data;

import lombok.Data;

import java.time.Instant;

@Data
public class RuleExecutionDTO {
    private Long id;
    private Long ruleId;
    private String originType;
    private Long originId;
    /**
     * applied / suppressed
     */
    private String outcome;
    /**
     * 仅 suppressed 时有值
     */
    private String suppressionReason;
    /**
     * 仅用户触发时有值
     */
    private Long userId;
    private String userEmail;
    private Instant createdAt;
}
