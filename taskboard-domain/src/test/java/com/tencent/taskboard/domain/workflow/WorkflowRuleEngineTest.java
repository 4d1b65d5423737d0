package com.tencent.taskboard.domain.workflow;

import com.tencent.taskboard.domain.DomainFixture;
import com.tencent.taskboard.domain.repository.InMemoryBoard;
import com.tencent.taskboard.domain.repository.InMemoryRuleRepository;
import com.tencent.taskboard.domain.task.Task;
import com.tencent.taskboard.domain.task.TaskStatus;
import com.tencent.taskboard.domain.task.TaskTransition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowRuleEngineTest {

    private static final long ORG = 1L;
    private static final long ALICE = 11L;
    private static final long ADMIN = 99L;

    private DomainFixture fixture;
    private InMemoryBoard board;
    private long projectId;
    private long typeId;
    private long workflowId;

    @BeforeEach
    void setUp() {
        fixture = new DomainFixture();
        board = fixture.board;
        projectId = board.project(ORG);
        typeId = board.taskType(projectId);
        workflowId = board.workflow(ORG, projectId, ADMIN);
    }

    private Task completedTask(Long cardId) {
        Task task = board.claimedTask(projectId, typeId, cardId, ALICE);
        fixture.lifecycleService.complete(task.getId(), ALICE, 2);
        return board.taskById(task.getId());
    }

    @Test
    void completionMaterializesTemplateAndRecordsApplied() {
        Rule rule = board.rule(workflowId, ResourceType.TASK, typeId, "completed");
        TaskTemplate template = board.template(rule.getId(), projectId, typeId, "Review", 1);
        Task task = completedTask(null);

        List<RuleExecution> executions = fixture.ruleEngine.onTransition(TransitionEvent.forTask(task, ALICE));

        assertEquals(1, executions.size());
        RuleExecution execution = executions.get(0);
        assertEquals(rule.getId(), execution.getRuleId());
        assertEquals(ExecutionOutcome.APPLIED, execution.getOutcome());
        assertNull(execution.getSuppressionReason());
        assertEquals(ALICE, execution.getUserId());

        List<Task> created = board.tasksCreatedBy(rule.getId());
        assertEquals(1, created.size());
        assertEquals(template.getName(), created.get(0).getTitle());
        assertEquals(TaskStatus.AVAILABLE, created.get(0).getStatus());
        assertEquals(projectId, created.get(0).getProjectId());
        assertEquals(ALICE, created.get(0).getCreatedBy());
        assertEquals(1, created.get(0).getVersion());
    }

    @Test
    void redeliveredEventIsSuppressedAsIdempotent() {
        Rule rule = board.rule(workflowId, ResourceType.TASK, typeId, "completed");
        board.template(rule.getId(), projectId, typeId, "Review", 1);
        Task task = completedTask(null);
        TransitionEvent event = TransitionEvent.forTask(task, ALICE);

        fixture.ruleEngine.onTransition(event);
        List<RuleExecution> second = fixture.ruleEngine.onTransition(event);

        assertEquals(1, second.size());
        assertEquals(ExecutionOutcome.SUPPRESSED, second.get(0).getOutcome());
        assertEquals(SuppressionReason.IDEMPOTENT, second.get(0).getSuppressionReason());
        assertEquals(1, board.tasksCreatedBy(rule.getId()).size());
        assertEquals(1, board.executions().stream().filter(RuleExecution::isApplied).count());
    }

    @Test
    void cascadeEventIsNotUserTriggeredUnlessRuleAllowsIt() {
        Rule userOnly = board.rule(workflowId, ResourceType.TASK, null, "available");
        Rule anyTrigger = board.rule(workflowId, ResourceType.TASK, null, "available");
        anyTrigger.setUserTriggeredOnly(false);
        board.template(anyTrigger.getId(), projectId, typeId, "Re-triage", 1);
        Task task = board.task(projectId, typeId, null, null);

        List<RuleExecution> executions = fixture.ruleEngine.onTransition(TransitionEvent.forTask(task, null));

        assertEquals(2, executions.size());
        assertEquals(userOnly.getId(), executions.get(0).getRuleId());
        assertEquals(SuppressionReason.NOT_USER_TRIGGERED, executions.get(0).getSuppressionReason());
        assertNull(executions.get(0).getUserId());
        assertEquals(ExecutionOutcome.APPLIED, executions.get(1).getOutcome());
        assertEquals(ADMIN, board.tasksCreatedBy(anyTrigger.getId()).get(0).getCreatedBy());
    }

    @Test
    void falseConditionIsNotMatching() {
        Rule rule = board.rule(workflowId, ResourceType.TASK, null, "completed");
        rule.setCondition("#task.priority >= 4");
        board.template(rule.getId(), projectId, typeId, "Escalate", 1);
        Task task = completedTask(null);

        List<RuleExecution> executions = fixture.ruleEngine.onTransition(TransitionEvent.forTask(task, ALICE));

        assertEquals(SuppressionReason.NOT_MATCHING, executions.get(0).getSuppressionReason());
        assertTrue(board.tasksCreatedBy(rule.getId()).isEmpty());
    }

    @Test
    void ruleDeactivatedAfterLookupIsInactive() {
        DomainFixture stale = new DomainFixture(b -> new InMemoryRuleRepository(b) {
            @Override
            public boolean isActive(long ruleId) {
                return false;
            }
        });
        long project = stale.board.project(ORG);
        long type = stale.board.taskType(project);
        long workflow = stale.board.workflow(ORG, project, ADMIN);
        Rule rule = stale.board.rule(workflow, ResourceType.TASK, null, "available");
        Task task = stale.board.task(project, type, null, null);

        List<RuleExecution> executions = stale.ruleEngine.onTransition(TransitionEvent.forTask(task, ALICE));

        assertEquals(1, executions.size());
        assertEquals(rule.getId(), executions.get(0).getRuleId());
        assertEquals(SuppressionReason.INACTIVE, executions.get(0).getSuppressionReason());
    }

    @Test
    void inactiveWorkflowRulesAreNotCandidates() {
        board.rule(workflowId, ResourceType.TASK, null, "completed");
        board.deactivateWorkflow(workflowId);
        Task task = completedTask(null);

        assertTrue(fixture.ruleEngine.onTransition(TransitionEvent.forTask(task, ALICE)).isEmpty());
    }

    @Test
    void rulesOutsideTheEventTargetNeverApply() {
        long otherType = board.taskType(projectId);
        board.rule(workflowId, ResourceType.TASK, otherType, "completed");
        board.rule(workflowId, ResourceType.TASK, typeId, "claimed");
        board.rule(workflowId, ResourceType.CARD, null, "completed");
        long otherOrgWorkflow = board.workflow(2L, null, ADMIN);
        board.rule(otherOrgWorkflow, ResourceType.TASK, null, "completed");
        Task task = completedTask(null);

        assertTrue(fixture.ruleEngine.onTransition(TransitionEvent.forTask(task, ALICE)).isEmpty());
        assertTrue(board.executions().isEmpty());
    }

    @Test
    void projectWorkflowsRunBeforeOrgWorkflows() {
        long orgWorkflow = board.workflow(ORG, null, ADMIN);
        Rule orgRule = board.rule(orgWorkflow, ResourceType.TASK, null, "completed");
        Rule projectRule = board.rule(workflowId, ResourceType.TASK, null, "completed");
        Task task = completedTask(null);

        List<Long> order = fixture.ruleEngine.onTransition(TransitionEvent.forTask(task, ALICE)).stream()
            .map(RuleExecution::getRuleId)
            .collect(Collectors.toList());

        assertEquals(List.of(projectRule.getId(), orgRule.getId()), order);
    }

    @Test
    void templatesApplyInExecutionOrderOnTheCardContext() {
        long cardId = board.card(projectId, null).getId();
        Rule rule = board.rule(workflowId, ResourceType.TASK, null, "completed");
        board.template(rule.getId(), projectId, typeId, "Second", 2);
        board.template(rule.getId(), projectId, typeId, "First", 1);
        board.template(rule.getId(), projectId, typeId, "Third", 2);
        Task task = completedTask(cardId);

        fixture.ruleEngine.onTransition(TransitionEvent.forTask(task, ALICE));

        List<Task> created = board.tasksCreatedBy(rule.getId());
        assertEquals(List.of("First", "Second", "Third"),
            created.stream().map(Task::getTitle).collect(Collectors.toList()));
        created.forEach(t -> {
            assertEquals(cardId, t.getCardId());
            assertNull(t.getMilestoneId());
        });
    }

    @Test
    void templateWithForeignTaskTypeAborts() {
        long foreignProject = board.project(ORG);
        long foreignType = board.taskType(foreignProject);
        Rule rule = board.rule(workflowId, ResourceType.TASK, null, "completed");
        board.template(rule.getId(), projectId, foreignType, "Broken", 1);
        Task task = completedTask(null);

        AutomationException e = assertThrows(AutomationException.class,
            () -> fixture.ruleEngine.onTransition(TransitionEvent.forTask(task, ALICE)));

        assertEquals(AutomationError.INVALID_TEMPLATE, e.getError());
        assertTrue(board.executions().isEmpty());
    }

    @Test
    void failedSuppressedWriteIsLeftOutWithoutFailingTheTransition() {
        Rule suppressed = board.rule(workflowId, ResourceType.TASK, null, "completed");
        suppressed.setCondition("false");
        Rule applied = board.rule(workflowId, ResourceType.TASK, null, "completed");
        fixture.executionRepository.failSuppressedWrites();
        Task task = board.claimedTask(projectId, typeId, null, ALICE);

        List<RuleExecution> executions = fixture.transition(TaskTransition.COMPLETE, task.getId(), ALICE, 2);

        assertEquals(1, executions.size());
        assertEquals(applied.getId(), executions.get(0).getRuleId());
        assertEquals(ExecutionOutcome.APPLIED, executions.get(0).getOutcome());
        assertEquals(TaskStatus.COMPLETED, board.taskById(task.getId()).getStatus());
    }
}
