package com.tencent.taskboard.domain.workflow.service;

import com.tencent.taskboard.domain.task.Task;
import com.tencent.taskboard.domain.workflow.Rule;
import com.tencent.taskboard.domain.workflow.RuleExecution;
import com.tencent.taskboard.domain.workflow.SuppressionReason;
import com.tencent.taskboard.domain.workflow.TransitionEvent;
import com.tencent.taskboard.domain.workflow.repository.RuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * WorkflowRuleEngine - 工作流规则引擎
 * <p>
 * 对每个候选规则依次检查抑制原因：停用 → 非用户触发 → 条件不满足 → 已应用（幂等）。
 * 未被抑制的规则生成模板任务并记录 applied，每个被评估的规则都对应一条记录。
 * 必须在触发迁移的事务内调用，生成任务或 applied 记录失败时异常向上抛出，迁移随之回滚。
 * </p>
 *
 * @author taskboard
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowRuleEngine {

    private final RuleRepository ruleRepository;
    private final RuleConditionEvaluator conditionEvaluator;
    private final TemplateMaterializer templateMaterializer;
    private final ExecutionRecorder executionRecorder;

    public List<RuleExecution> onTransition(TransitionEvent event) {
        List<Rule> rules = ruleRepository.findMatching(event);
        if (rules.isEmpty()) {
            return Collections.emptyList();
        }
        log.debug("{} [{}] -> {}: {} candidate rules", event.getResourceType().getCode(),
            event.getResourceId(), event.getToState(), rules.size());

        List<RuleExecution> executions = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            Optional<SuppressionReason> suppression = suppressionFor(rule, event);
            if (suppression.isPresent()) {
                recordSuppressed(rule, event, suppression.get()).ifPresent(executions::add);
                continue;
            }

            List<Task> created = templateMaterializer.materialize(rule, event);
            executions.add(executionRecorder.recordApplied(rule, event));
            log.info("Applied rule [{}] on {} [{}] -> {}, created tasks {}", rule.getId(),
                event.getResourceType().getCode(), event.getResourceId(), event.getToState(),
                created.stream().map(Task::getId).collect(Collectors.toList()));
        }
        return executions;
    }

    private Optional<SuppressionReason> suppressionFor(Rule rule, TransitionEvent event) {
        if (!ruleRepository.isActive(rule.getId())) {
            return Optional.of(SuppressionReason.INACTIVE);
        }
        if (event.getTriggeredBy() == null && rule.isUserTriggeredOnly()) {
            return Optional.of(SuppressionReason.NOT_USER_TRIGGERED);
        }
        if (!rule.getTarget().matches(event) || !conditionEvaluator.matches(rule, event)) {
            return Optional.of(SuppressionReason.NOT_MATCHING);
        }
        if (executionRecorder.hasApplied(rule, event)) {
            return Optional.of(SuppressionReason.IDEMPOTENT);
        }
        return Optional.empty();
    }

    /**
     * 抑制记录尽力写入：失败只记录日志，不影响触发它的迁移
     */
    private Optional<RuleExecution> recordSuppressed(Rule rule, TransitionEvent event, SuppressionReason reason) {
        try {
            return Optional.of(executionRecorder.recordSuppressed(rule, event, reason));
        } catch (DataAccessException e) {
            log.error("Failed to record suppressed execution of rule [{}] for {} [{}] ({})", rule.getId(),
                event.getResourceType().getCode(), event.getResourceId(), reason.getCode(), e);
            return Optional.empty();
        }
    }
}
