package com.tencent.taskboard.client.dto.data;

import lombok.Data;

import java.time.Instant;

@Data
public class MilestoneDTO {
    private Long id;
    private Long projectId;
    private String name;
    private String description;
    /**
     * ready / active / completed
     */
    private String state;
    private Integer position;
    private Long createdBy;
    private Instant createdAt;
    private Instant activatedAt;
    private Instant completedAt;
}
