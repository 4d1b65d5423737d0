package com.tencent.taskboard.domain.repository;

import com.tencent.taskboard.domain.workflow.Rule;
import com.tencent.taskboard.domain.workflow.TaskTemplate;
import com.tencent.taskboard.domain.workflow.TransitionEvent;
import com.tencent.taskboard.domain.workflow.repository.RuleRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public class InMemoryRuleRepository implements RuleRepository {

    private final InMemoryBoard board;

    public InMemoryRuleRepository(InMemoryBoard board) {
        this.board = board;
    }

    @Override
    public List<Rule> findMatching(TransitionEvent event) {
        Long orgId = board.projectOrgs.get(event.getProjectId());
        return board.rules.values().stream()
            .filter(rule -> flagsActive(rule.getId()))
            .filter(rule -> {
                InMemoryBoard.WorkflowRow workflow = board.workflows.get(rule.getWorkflowId());
                return Objects.equals(workflow.getOrgId(), orgId)
                    && (workflow.getProjectId() == null || workflow.getProjectId().equals(event.getProjectId()));
            })
            .filter(rule -> rule.getTarget().matches(event))
            .sorted(Comparator.comparing((Rule rule) -> rule.getWorkflowProjectId() == null)
                .thenComparing(Rule::getId))
            .collect(Collectors.toList());
    }

    @Override
    public boolean isActive(long ruleId) {
        return flagsActive(ruleId);
    }

    private boolean flagsActive(long ruleId) {
        Rule rule = board.rules.get(ruleId);
        return rule != null && rule.isActive() && board.workflows.get(rule.getWorkflowId()).isActive();
    }

    @Override
    public List<TaskTemplate> findTemplates(long ruleId) {
        return board.templates.getOrDefault(ruleId, List.of()).stream()
            .sorted(Comparator.comparing(TaskTemplate::getExecutionOrder).thenComparing(TaskTemplate::getId))
            .collect(Collectors.toList());
    }
}
