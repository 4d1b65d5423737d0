package com.tencent.taskboard.client.dto.data;

import lombok.Data;

import java.time.Instant;

@Data
public class TaskDTO {
    private Long id;
    private Long projectId;
    private Long typeId;
    private Long cardId;
    private Long milestoneId;
    private String title;
    private String description;
    private Integer priority;
    /**
     * available / claimed / completed
     */
    private String status;
    private Long claimedBy;
    private Instant claimedAt;
    private Instant completedAt;
    private Long createdBy;
    private Instant createdAt;
    private Long createdFromRuleId;
    private Integer version;
}
