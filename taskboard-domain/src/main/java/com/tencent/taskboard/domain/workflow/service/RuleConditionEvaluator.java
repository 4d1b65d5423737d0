package com.tencent.taskboard.domain.workflow.service;

import com.tencent.taskboard.domain.workflow.Rule;
import com.tencent.taskboard.domain.workflow.TransitionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * RuleConditionEvaluator - 规则附加条件求值
 * <p>
 * 条件是 SpEL 表达式，可用变量：{@code #event}，任务事件的 {@code #task}，卡片事件的 {@code #card}。
 * 例如 {@code #task.priority >= 4}、{@code #event.milestoneId != null}。
 * 条件为空视为满足；解析或求值失败视为不满足。
 * </p>
 *
 * @author taskboard
 */
@Slf4j
@Component
public class RuleConditionEvaluator {

    private final ExpressionParser parser = new SpelExpressionParser();

    public boolean matches(Rule rule, TransitionEvent event) {
        String condition = rule.getCondition();
        if (condition == null || condition.isBlank()) {
            return true;
        }
        try {
            Expression exp = parser.parseExpression(condition);
            Boolean result = exp.getValue(createEvaluationContext(event), Boolean.class);
            return result != null && result;
        } catch (ExpressionException e) {
            log.warn("Condition evaluation failed for rule [{}]: [{}]", rule.getId(), condition, e);
            return false;
        }
    }

    @NonNull
    private EvaluationContext createEvaluationContext(TransitionEvent event) {
        SimpleEvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding()
            .withInstanceMethods()
            .withRootObject(event)
            .build();
        context.setVariable("event", event);
        context.setVariable(event.isTaskEvent() ? "task" : "card", event.getSubject());
        return context;
    }
}
