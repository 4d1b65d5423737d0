package com.tencent.taskboard.client.dto.data;

import lombok.Data;

@Data
public class CardDTO {
    private Long id;
    private Long projectId;
    /**
     * null 表示在需求池中
     */
    private Long milestoneId;
    private String title;
    private String description;
    /**
     * pending / in_progress / closed，由卡片下任务推导
     */
    private String state;
    private int taskCount;
    private int availableCount;
    private int completedCount;
    private Integer version;
}
