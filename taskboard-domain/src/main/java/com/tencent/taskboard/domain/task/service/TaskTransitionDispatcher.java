package com.tencent.taskboard.domain.task.service;

import com.tencent.taskboard.domain.card.Card;
import com.tencent.taskboard.domain.card.CardState;
import com.tencent.taskboard.domain.card.repository.CardRepository;
import com.tencent.taskboard.domain.milestone.service.MilestoneCompletionService;
import com.tencent.taskboard.domain.task.Task;
import com.tencent.taskboard.domain.task.TaskEvent;
import com.tencent.taskboard.domain.task.TaskTransition;
import com.tencent.taskboard.domain.task.TaskTransitionResult;
import com.tencent.taskboard.domain.task.repository.TaskEventRepository;
import com.tencent.taskboard.domain.workflow.RuleExecution;
import com.tencent.taskboard.domain.workflow.TransitionEvent;
import com.tencent.taskboard.domain.workflow.service.WorkflowRuleEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * TaskTransitionDispatcher - 任务迁移成功后的副作用，与迁移同一事务
 * <ol>
 *   <li>用户触发的迁移追加审计事件</li>
 *   <li>任务迁移事件交给规则引擎</li>
 *   <li>所在卡片的推导状态发生变化时，卡片迁移事件交给规则引擎</li>
 *   <li>完成任务后重新计算有效里程碑</li>
 * </ol>
 *
 * @author taskboard
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskTransitionDispatcher {

    private final TaskEventRepository taskEventRepository;
    private final CardRepository cardRepository;
    private final WorkflowRuleEngine ruleEngine;
    private final MilestoneCompletionService milestoneCompletionService;

    public List<RuleExecution> dispatch(TaskTransitionResult result) {
        Task task = result.getTask();
        if (result.getTriggeredBy() != null) {
            taskEventRepository.append(TaskEvent.builder()
                .projectId(task.getProjectId())
                .taskId(task.getId())
                .actorUserId(result.getTriggeredBy())
                .eventType(result.getTransition().getEventType())
                .createdAt(Instant.now())
                .build());
        }

        // card counts are read before automation adds tasks to the card
        Optional<TransitionEvent> cardEvent = cardTransition(result);

        List<RuleExecution> executions = new ArrayList<>(
            ruleEngine.onTransition(TransitionEvent.forTask(task, result.getTriggeredBy())));
        cardEvent.ifPresent(event -> executions.addAll(ruleEngine.onTransition(event)));

        if (result.getTransition() == TaskTransition.COMPLETE) {
            milestoneCompletionService.recomputeForTask(task.getId());
        }
        return executions;
    }

    private Optional<TransitionEvent> cardTransition(TaskTransitionResult result) {
        Long cardId = result.getTask().getCardId();
        if (cardId == null || !cardRepository.lockForUpdate(cardId)) {
            return Optional.empty();
        }
        Optional<Card> card = cardRepository.findById(cardId);
        if (card.isEmpty()) {
            return Optional.empty();
        }

        CardState after = card.get().getState();
        CardState before = card.get().getProgress()
            .revert(result.getPreviousStatus(), result.getTask().getStatus())
            .state();
        if (before == after) {
            return Optional.empty();
        }
        log.debug("Card [{}] {} -> {} after task [{}]", cardId, before.getCode(), after.getCode(),
            result.getTask().getId());
        return Optional.of(TransitionEvent.forCard(card.get(), after, result.getTriggeredBy()));
    }
}
