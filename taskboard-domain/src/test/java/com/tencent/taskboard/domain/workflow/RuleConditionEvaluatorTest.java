package com.tencent.taskboard.domain.workflow;

import com.tencent.taskboard.domain.card.Card;
import com.tencent.taskboard.domain.card.CardProgress;
import com.tencent.taskboard.domain.card.CardState;
import com.tencent.taskboard.domain.task.Task;
import com.tencent.taskboard.domain.task.TaskStatus;
import com.tencent.taskboard.domain.workflow.service.RuleConditionEvaluator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuleConditionEvaluatorTest {

    private final RuleConditionEvaluator evaluator = new RuleConditionEvaluator();

    private static Rule withCondition(String condition) {
        return Rule.builder().id(1L).condition(condition).build();
    }

    private static TransitionEvent taskEvent(int priority) {
        Task task = Task.builder().id(5L).projectId(1L).typeId(2L).priority(priority)
            .status(TaskStatus.COMPLETED).version(3).build();
        return TransitionEvent.forTask(task, 7L);
    }

    @Test
    void blankConditionAlwaysMatches() {
        assertTrue(evaluator.matches(withCondition(null), taskEvent(1)));
        assertTrue(evaluator.matches(withCondition("  "), taskEvent(1)));
    }

    @Test
    void taskVariablesAreVisible() {
        Rule urgent = withCondition("#task.priority >= 4 && #event.toState == 'completed'");
        assertTrue(evaluator.matches(urgent, taskEvent(5)));
        assertFalse(evaluator.matches(urgent, taskEvent(2)));
        assertTrue(evaluator.matches(withCondition("#event.triggeredBy == 7"), taskEvent(1)));
    }

    @Test
    void cardVariablesAreVisible() {
        Card card = Card.builder().id(9L).projectId(1L).milestoneId(3L).version(1)
            .progress(new CardProgress(2, 0, 2)).build();
        TransitionEvent event = TransitionEvent.forCard(card, CardState.CLOSED, 7L);

        assertTrue(evaluator.matches(withCondition("#card.progress.taskCount == 2"), event));
        assertTrue(evaluator.matches(withCondition("#event.milestoneId != null"), event));
    }

    @Test
    void brokenExpressionDoesNotMatch() {
        assertFalse(evaluator.matches(withCondition("#task.priority >="), taskEvent(5)));
        assertFalse(evaluator.matches(withCondition("#task.noSuchField == 1"), taskEvent(5)));
        assertFalse(evaluator.matches(withCondition("T(java.lang.Runtime).getRuntime() != null"), taskEvent(5)));
    }
}
