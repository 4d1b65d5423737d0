package com.tencent.taskboard.infrastructure.persistence.milestone.converter;

import com.tencent.taskboard.domain.milestone.Milestone;
import com.tencent.taskboard.domain.milestone.MilestoneProgress;
import com.tencent.taskboard.domain.milestone.MilestoneState;
import com.tencent.taskboard.infrastructure.persistence.milestone.entity.MilestoneDO;
import com.tencent.taskboard.infrastructure.persistence.milestone.entity.MilestoneProgressDO;

/**
 * MilestoneConverter - 里程碑转换器
 *
 * @author taskboard
 */
public class MilestoneConverter {

    public static Milestone toDomain(MilestoneDO dataObject) {
        if (dataObject == null) {
            return null;
        }

        return Milestone.builder()
            .id(dataObject.getId())
            .projectId(dataObject.getProjectId())
            .name(dataObject.getName())
            .description(dataObject.getDescription())
            .state(MilestoneState.fromCode(dataObject.getState()))
            .position(dataObject.getPosition())
            .createdBy(dataObject.getCreatedBy())
            .createdAt(dataObject.getCreatedAt())
            .activatedAt(dataObject.getActivatedAt())
            .completedAt(dataObject.getCompletedAt())
            .build();
    }

    public static MilestoneProgress progressToDomain(MilestoneProgressDO dataObject) {
        if (dataObject == null) {
            return new MilestoneProgress(0, 0, 0, 0);
        }
        return new MilestoneProgress(
            count(dataObject.getCardsTotal()),
            count(dataObject.getCardsClosed()),
            count(dataObject.getTasksTotal()),
            count(dataObject.getTasksCompleted()));
    }

    private static int count(Integer value) {
        return value == null ? 0 : value;
    }
}
