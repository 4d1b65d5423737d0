package com.tencent.taskboard.domain.workflow;

import com.tencent.taskboard.domain.card.Card;
import com.tencent.taskboard.domain.card.CardState;
import com.tencent.taskboard.domain.task.Task;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * TransitionEvent - 任务或卡片的状态迁移事件，规则引擎的输入
 *
 * @author taskboard
 */
@Value
@Builder
public class TransitionEvent {

    ResourceType resourceType;

    Long resourceId;

    Long projectId;

    /**
     * 仅任务事件有值
     */
    Long taskTypeId;

    /**
     * 卡片上下文：任务事件为任务所在卡片，卡片事件为卡片自身
     */
    Long cardId;

    /**
     * 里程碑上下文：不在卡片下的任务取自身 milestone_id，卡片事件取卡片的 milestone_id
     */
    Long milestoneId;

    /**
     * 迁移后的状态编码
     */
    String toState;

    /**
     * 触发用户，级联迁移时为空
     */
    Long triggeredBy;

    /**
     * 迁移后的任务或卡片，供规则条件表达式读取
     */
    Object subject;

    public Optional<Long> getTriggeringUser() {
        return Optional.ofNullable(triggeredBy);
    }

    public boolean isTaskEvent() {
        return resourceType == ResourceType.TASK;
    }

    public static TransitionEvent forTask(Task task, Long triggeredBy) {
        return TransitionEvent.builder()
            .resourceType(ResourceType.TASK)
            .resourceId(task.getId())
            .projectId(task.getProjectId())
            .taskTypeId(task.getTypeId())
            .cardId(task.getCardId())
            .milestoneId(task.getCardId() == null ? task.getMilestoneId() : null)
            .toState(task.getStatus().getCode())
            .triggeredBy(triggeredBy)
            .subject(task)
            .build();
    }

    public static TransitionEvent forCard(Card card, CardState toState, Long triggeredBy) {
        return TransitionEvent.builder()
            .resourceType(ResourceType.CARD)
            .resourceId(card.getId())
            .projectId(card.getProjectId())
            .cardId(card.getId())
            .milestoneId(card.getMilestoneId())
            .toState(toState.getCode())
            .triggeredBy(triggeredBy)
            .subject(card)
            .build();
    }
}
