package com.tencent.taskboard.domain.workflow.service;

import com.tencent.taskboard.domain.workflow.ExecutionOutcome;
import com.tencent.taskboard.domain.workflow.Rule;
import com.tencent.taskboard.domain.workflow.RuleExecution;
import com.tencent.taskboard.domain.workflow.SuppressionReason;
import com.tencent.taskboard.domain.workflow.TransitionEvent;
import com.tencent.taskboard.domain.workflow.repository.RuleExecutionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * ExecutionRecorder - 规则评估记录
 * <p>
 * applied 记录与生成的任务同属一个事务，失败时整体回滚；
 * suppressed 记录写在嵌套事务（保存点）中，失败只回滚到保存点，由调用方决定如何处理。
 * </p>
 *
 * @author taskboard
 */
@Service
@RequiredArgsConstructor
public class ExecutionRecorder {

    private final RuleExecutionRepository ruleExecutionRepository;

    public boolean hasApplied(Rule rule, TransitionEvent event) {
        return ruleExecutionRepository.existsApplied(rule.getId(), event.getResourceType(), event.getResourceId());
    }

    public RuleExecution recordApplied(Rule rule, TransitionEvent event) {
        return ruleExecutionRepository.append(newExecution(rule, event, ExecutionOutcome.APPLIED, null));
    }

    @Transactional(propagation = Propagation.NESTED)
    public RuleExecution recordSuppressed(Rule rule, TransitionEvent event, SuppressionReason reason) {
        return ruleExecutionRepository.append(newExecution(rule, event, ExecutionOutcome.SUPPRESSED, reason));
    }

    private static RuleExecution newExecution(Rule rule, TransitionEvent event,
                                              ExecutionOutcome outcome, SuppressionReason reason) {
        return RuleExecution.builder()
            .ruleId(rule.getId())
            .originType(event.getResourceType())
            .originId(event.getResourceId())
            .outcome(outcome)
            .suppressionReason(reason)
            .userId(event.getTriggeredBy())
            .createdAt(Instant.now())
            .build();
    }
}
