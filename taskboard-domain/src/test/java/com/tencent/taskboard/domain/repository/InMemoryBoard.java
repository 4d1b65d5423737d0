package com.tencent.taskboard.domain.repository;

import com.tencent.taskboard.domain.card.Card;
import com.tencent.taskboard.domain.milestone.Milestone;
import com.tencent.taskboard.domain.milestone.MilestoneState;
import com.tencent.taskboard.domain.task.Task;
import com.tencent.taskboard.domain.task.TaskEvent;
import com.tencent.taskboard.domain.task.TaskStatus;
import com.tencent.taskboard.domain.workflow.ResourceType;
import com.tencent.taskboard.domain.workflow.Rule;
import com.tencent.taskboard.domain.workflow.RuleExecution;
import com.tencent.taskboard.domain.workflow.RuleTarget;
import com.tencent.taskboard.domain.workflow.TaskTemplate;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存中的看板数据，供各个内存仓储共享
 */
public class InMemoryBoard {

    private final AtomicLong sequence = new AtomicLong(100);

    final Map<Long, Long> projectOrgs = new ConcurrentHashMap<>();
    final Map<Long, Long> taskTypeProjects = new ConcurrentHashMap<>();
    final Map<Long, Task> tasks = new ConcurrentHashMap<>();
    final Map<Long, Card> cards = new ConcurrentHashMap<>();
    final Map<Long, Milestone> milestones = new ConcurrentHashMap<>();
    final Map<Long, WorkflowRow> workflows = new ConcurrentHashMap<>();
    final Map<Long, Rule> rules = new ConcurrentHashMap<>();
    final Map<Long, List<TaskTemplate>> templates = new ConcurrentHashMap<>();
    final List<RuleExecution> executions = new CopyOnWriteArrayList<>();
    final List<TaskEvent> events = new CopyOnWriteArrayList<>();

    @Data
    @AllArgsConstructor
    static class WorkflowRow {
        private Long id;
        private Long orgId;
        private Long projectId;
        private boolean active;
        private Long createdBy;
    }

    public long nextId() {
        return sequence.incrementAndGet();
    }

    public long project(long orgId) {
        long id = nextId();
        projectOrgs.put(id, orgId);
        return id;
    }

    public long taskType(long projectId) {
        long id = nextId();
        taskTypeProjects.put(id, projectId);
        return id;
    }

    public Milestone milestone(long projectId, MilestoneState state) {
        Instant now = Instant.now();
        Milestone milestone = Milestone.builder()
            .id(nextId())
            .projectId(projectId)
            .name("Milestone")
            .state(state)
            .position(0)
            .createdBy(1L)
            .createdAt(now)
            .activatedAt(state == MilestoneState.READY ? null : now)
            .completedAt(state == MilestoneState.COMPLETED ? now : null)
            .build();
        milestones.put(milestone.getId(), milestone);
        return milestone;
    }

    public Card card(long projectId, Long milestoneId) {
        Card card = Card.builder()
            .id(nextId())
            .projectId(projectId)
            .milestoneId(milestoneId)
            .title("Card")
            .createdBy(1L)
            .createdAt(Instant.now())
            .version(1)
            .build();
        cards.put(card.getId(), card);
        return card;
    }

    public Task task(long projectId, long typeId, Long cardId, Long milestoneId) {
        Task task = Task.builder()
            .id(nextId())
            .projectId(projectId)
            .typeId(typeId)
            .cardId(cardId)
            .milestoneId(milestoneId)
            .title("Task")
            .priority(3)
            .status(TaskStatus.AVAILABLE)
            .createdBy(1L)
            .createdAt(Instant.now())
            .version(1)
            .build();
        tasks.put(task.getId(), task);
        return task.toBuilder().build();
    }

    public Task claimedTask(long projectId, long typeId, Long cardId, long userId) {
        Task task = task(projectId, typeId, cardId, null);
        task.setStatus(TaskStatus.CLAIMED);
        task.setClaimedBy(userId);
        task.setClaimedAt(Instant.now());
        task.setVersion(2);
        tasks.put(task.getId(), task.toBuilder().build());
        return task;
    }

    public long workflow(long orgId, Long projectId, long createdBy) {
        long id = nextId();
        workflows.put(id, new WorkflowRow(id, orgId, projectId, true, createdBy));
        return id;
    }

    public Rule rule(long workflowId, ResourceType resourceType, Long taskTypeId, String toState) {
        WorkflowRow workflow = workflows.get(workflowId);
        Rule rule = Rule.builder()
            .id(nextId())
            .workflowId(workflowId)
            .workflowProjectId(workflow.getProjectId())
            .workflowCreatedBy(workflow.getCreatedBy())
            .name("Rule")
            .target(new RuleTarget(resourceType, taskTypeId, toState))
            .active(true)
            .build();
        rules.put(rule.getId(), rule);
        return rule;
    }

    public TaskTemplate template(long ruleId, long projectId, long typeId, String name, int executionOrder) {
        TaskTemplate template = TaskTemplate.builder()
            .id(nextId())
            .projectId(projectId)
            .name(name)
            .typeId(typeId)
            .priority(3)
            .executionOrder(executionOrder)
            .build();
        templates.computeIfAbsent(ruleId, k -> new CopyOnWriteArrayList<>()).add(template);
        return template;
    }

    public void moveTaskToMilestone(long taskId, long milestoneId) {
        tasks.get(taskId).setMilestoneId(milestoneId);
    }

    public void deactivateWorkflow(long workflowId) {
        workflows.get(workflowId).setActive(false);
    }

    public Task taskById(long taskId) {
        return tasks.get(taskId).toBuilder().build();
    }

    public Milestone milestoneById(long milestoneId) {
        return milestones.get(milestoneId).toBuilder().build();
    }

    public List<Task> tasksCreatedBy(long ruleId) {
        List<Task> created = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (task.getCreatedFromRuleId() != null && task.getCreatedFromRuleId() == ruleId) {
                created.add(task.toBuilder().build());
            }
        }
        created.sort((a, b) -> Long.compare(a.getId(), b.getId()));
        return created;
    }

    public List<RuleExecution> executions() {
        return new ArrayList<>(executions);
    }

    public List<TaskEvent> events() {
        return new ArrayList<>(events);
    }
}
