package com.tencent.taskboard.infrastructure.persistence.workflow.converter;

import com.tencent.taskboard.domain.workflow.ResourceType;
import com.tencent.taskboard.domain.workflow.Rule;
import com.tencent.taskboard.domain.workflow.RuleTarget;
import com.tencent.taskboard.domain.workflow.TaskTemplate;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.RuleViewDO;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.TaskTemplateDO;

/**
 * RuleConverter - 规则与模板转换器
 *
 * @author taskboard
 */
public class RuleConverter {

    public static Rule toDomain(RuleViewDO dataObject) {
        if (dataObject == null) {
            return null;
        }

        RuleTarget target = new RuleTarget(
            ResourceType.fromCode(dataObject.getResourceType()),
            dataObject.getTaskTypeId(),
            dataObject.getToState());
        return Rule.builder()
            .id(dataObject.getId())
            .workflowId(dataObject.getWorkflowId())
            .workflowProjectId(dataObject.getWorkflowProjectId())
            .workflowCreatedBy(dataObject.getWorkflowCreatedBy())
            .name(dataObject.getName())
            .goal(dataObject.getGoal())
            .target(target)
            .active(Boolean.TRUE.equals(dataObject.getActive()))
            .userTriggeredOnly(!Boolean.FALSE.equals(dataObject.getUserTriggeredOnly()))
            .condition(dataObject.getConditionExpr())
            .build();
    }

    public static TaskTemplate templateToDomain(TaskTemplateDO dataObject) {
        if (dataObject == null) {
            return null;
        }

        return TaskTemplate.builder()
            .id(dataObject.getId())
            .projectId(dataObject.getProjectId())
            .name(dataObject.getName())
            .description(dataObject.getDescription())
            .typeId(dataObject.getTypeId())
            .priority(dataObject.getPriority())
            .executionOrder(dataObject.getExecutionOrder())
            .build();
    }
}
