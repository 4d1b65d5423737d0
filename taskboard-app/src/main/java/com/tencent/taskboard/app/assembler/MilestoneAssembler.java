package com.tencent.taskboard.app.assembler;

import com.tencent.taskboard.client.dto.data.ActivationDTO;
import com.tencent.taskboard.client.dto.data.MilestoneDTO;
import com.tencent.taskboard.domain.milestone.ActivationSnapshot;
import com.tencent.taskboard.domain.milestone.Milestone;

/**
 * MilestoneAssembler - 里程碑领域对象转 DTO
 *
 * @author taskboard
 */
public class MilestoneAssembler {

    public static MilestoneDTO toDTO(Milestone milestone) {
        MilestoneDTO dto = new MilestoneDTO();
        dto.setId(milestone.getId());
        dto.setProjectId(milestone.getProjectId());
        dto.setName(milestone.getName());
        dto.setDescription(milestone.getDescription());
        dto.setState(milestone.getState().getCode());
        dto.setPosition(milestone.getPosition());
        dto.setCreatedBy(milestone.getCreatedBy());
        dto.setCreatedAt(milestone.getCreatedAt());
        dto.setActivatedAt(milestone.getActivatedAt());
        dto.setCompletedAt(milestone.getCompletedAt());
        return dto;
    }

    public static ActivationDTO toDTO(ActivationSnapshot snapshot) {
        ActivationDTO dto = new ActivationDTO();
        dto.setMilestone(toDTO(snapshot.getMilestone()));
        dto.setCardsReleased(snapshot.getCardsReleased());
        dto.setTasksReleased(snapshot.getTasksReleased());
        return dto;
    }
}
