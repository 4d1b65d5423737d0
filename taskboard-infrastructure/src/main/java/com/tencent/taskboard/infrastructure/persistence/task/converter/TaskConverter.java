package com.tencent.taskboard.infrastructure.persistence.task.converter;

import com.tencent.taskboard.domain.task.Task;
import com.tencent.taskboard.domain.task.TaskEvent;
import com.tencent.taskboard.domain.task.TaskStatus;
import com.tencent.taskboard.infrastructure.persistence.task.entity.TaskDO;
import com.tencent.taskboard.infrastructure.persistence.task.entity.TaskEventDO;

/**
 * TaskConverter - 任务转换器
 * <p>
 * 负责领域对象与数据对象之间的转换
 * </p>
 *
 * @author taskboard
 */
public class TaskConverter {

    /**
     * 领域对象转数据对象
     */
    public static TaskDO toDataObject(Task domain) {
        if (domain == null) {
            return null;
        }

        TaskDO dataObject = new TaskDO();
        dataObject.setId(domain.getId());
        dataObject.setProjectId(domain.getProjectId());
        dataObject.setTypeId(domain.getTypeId());
        dataObject.setCardId(domain.getCardId());
        dataObject.setMilestoneId(domain.getMilestoneId());
        dataObject.setTitle(domain.getTitle());
        dataObject.setDescription(domain.getDescription());
        dataObject.setPriority(domain.getPriority());
        dataObject.setStatus(domain.getStatus() != null ? domain.getStatus().getCode() : null);
        dataObject.setClaimedBy(domain.getClaimedBy());
        dataObject.setClaimedAt(domain.getClaimedAt());
        dataObject.setCompletedAt(domain.getCompletedAt());
        dataObject.setCreatedBy(domain.getCreatedBy());
        dataObject.setCreatedAt(domain.getCreatedAt());
        dataObject.setCreatedFromRuleId(domain.getCreatedFromRuleId());
        dataObject.setVersion(domain.getVersion());
        return dataObject;
    }

    /**
     * 数据对象转领域对象
     */
    public static Task toDomain(TaskDO dataObject) {
        if (dataObject == null) {
            return null;
        }

        return Task.builder()
            .id(dataObject.getId())
            .projectId(dataObject.getProjectId())
            .typeId(dataObject.getTypeId())
            .cardId(dataObject.getCardId())
            .milestoneId(dataObject.getMilestoneId())
            .title(dataObject.getTitle())
            .description(dataObject.getDescription())
            .priority(dataObject.getPriority())
            .status(TaskStatus.fromCode(dataObject.getStatus()))
            .claimedBy(dataObject.getClaimedBy())
            .claimedAt(dataObject.getClaimedAt())
            .completedAt(dataObject.getCompletedAt())
            .createdBy(dataObject.getCreatedBy())
            .createdAt(dataObject.getCreatedAt())
            .createdFromRuleId(dataObject.getCreatedFromRuleId())
            .version(dataObject.getVersion())
            .build();
    }

    public static TaskEventDO eventToDataObject(TaskEvent event) {
        TaskEventDO dataObject = new TaskEventDO();
        dataObject.setProjectId(event.getProjectId());
        dataObject.setTaskId(event.getTaskId());
        dataObject.setActorUserId(event.getActorUserId());
        dataObject.setEventType(event.getEventType());
        dataObject.setCreatedAt(event.getCreatedAt());
        return dataObject;
    }
}
