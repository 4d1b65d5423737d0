package com.tencent.taskboard.client.dto.data;

import lombok.Data;

/**
 * 里程碑激活结果快照
 */
@Data
public class ActivationDTO {
    private MilestoneDTO milestone;
    private long cardsReleased;
    private long tasksReleased;
}
