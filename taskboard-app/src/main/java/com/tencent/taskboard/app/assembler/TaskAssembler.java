package com.tencent.taskboard.app.assembler;

import com.tencent.taskboard.client.dto.data.TaskDTO;
import com.tencent.taskboard.domain.task.Task;

/**
 * TaskAssembler - 任务领域对象转 DTO
 *
 * @author taskboard
 */
public class TaskAssembler {

    public static TaskDTO toDTO(Task task) {
        TaskDTO dto = new TaskDTO();
        dto.setId(task.getId());
        dto.setProjectId(task.getProjectId());
        dto.setTypeId(task.getTypeId());
        dto.setCardId(task.getCardId());
        dto.setMilestoneId(task.getMilestoneId());
        dto.setTitle(task.getTitle());
        dto.setDescription(task.getDescription());
        dto.setPriority(task.getPriority());
        dto.setStatus(task.getStatus().getCode());
        dto.setClaimedBy(task.getClaimedBy());
        dto.setClaimedAt(task.getClaimedAt());
        dto.setCompletedAt(task.getCompletedAt());
        dto.setCreatedBy(task.getCreatedBy());
        dto.setCreatedAt(task.getCreatedAt());
        dto.setCreatedFromRuleId(task.getCreatedFromRuleId());
        dto.setVersion(task.getVersion());
        return dto;
    }
}
