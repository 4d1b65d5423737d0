package com.tencent.taskboard.domain;

import com.tencent.taskboard.domain.card.service.CardPlacementService;
import com.tencent.taskboard.domain.milestone.service.MilestoneActivationService;
import com.tencent.taskboard.domain.milestone.service.MilestoneCompletionService;
import com.tencent.taskboard.domain.repository.InMemoryBoard;
import com.tencent.taskboard.domain.repository.InMemoryCardRepository;
import com.tencent.taskboard.domain.repository.InMemoryMilestoneRepository;
import com.tencent.taskboard.domain.repository.InMemoryProjectRepository;
import com.tencent.taskboard.domain.repository.InMemoryRuleExecutionRepository;
import com.tencent.taskboard.domain.repository.InMemoryRuleRepository;
import com.tencent.taskboard.domain.repository.InMemoryTaskEventRepository;
import com.tencent.taskboard.domain.repository.InMemoryTaskRepository;
import com.tencent.taskboard.domain.task.TaskTransition;
import com.tencent.taskboard.domain.task.TaskTransitionResult;
import com.tencent.taskboard.domain.task.service.ConflictClassifier;
import com.tencent.taskboard.domain.task.service.TaskLifecycleService;
import com.tencent.taskboard.domain.task.service.TaskTransitionDispatcher;
import com.tencent.taskboard.domain.workflow.RuleExecution;
import com.tencent.taskboard.domain.workflow.service.ExecutionRecorder;
import com.tencent.taskboard.domain.workflow.service.RuleConditionEvaluator;
import com.tencent.taskboard.domain.workflow.service.TemplateMaterializer;
import com.tencent.taskboard.domain.workflow.service.WorkflowRuleEngine;

import java.util.List;
import java.util.function.Function;

/**
 * 基于内存仓储装配的领域服务
 */
public class DomainFixture {

    public final InMemoryBoard board = new InMemoryBoard();

    public final InMemoryTaskRepository taskRepository = new InMemoryTaskRepository(board);
    public final InMemoryCardRepository cardRepository = new InMemoryCardRepository(board);
    public final InMemoryMilestoneRepository milestoneRepository = new InMemoryMilestoneRepository(board);
    public final InMemoryProjectRepository projectRepository = new InMemoryProjectRepository(board);
    public final InMemoryRuleRepository ruleRepository;
    public final InMemoryRuleExecutionRepository executionRepository = new InMemoryRuleExecutionRepository(board);

    public final TaskLifecycleService lifecycleService;
    public final WorkflowRuleEngine ruleEngine;
    public final TaskTransitionDispatcher dispatcher;
    public final MilestoneActivationService activationService;
    public final MilestoneCompletionService completionService;
    public final CardPlacementService placementService;

    public DomainFixture() {
        this(InMemoryRuleRepository::new);
    }

    public DomainFixture(Function<InMemoryBoard, InMemoryRuleRepository> ruleRepositoryFactory) {
        ruleRepository = ruleRepositoryFactory.apply(board);
        lifecycleService = new TaskLifecycleService(taskRepository, milestoneRepository,
            new ConflictClassifier(taskRepository));
        ruleEngine = new WorkflowRuleEngine(ruleRepository, new RuleConditionEvaluator(),
            new TemplateMaterializer(ruleRepository, projectRepository, taskRepository),
            new ExecutionRecorder(executionRepository));
        completionService = new MilestoneCompletionService(milestoneRepository);
        dispatcher = new TaskTransitionDispatcher(new InMemoryTaskEventRepository(board), cardRepository,
            ruleEngine, completionService);
        activationService = new MilestoneActivationService(projectRepository, milestoneRepository);
        placementService = new CardPlacementService(cardRepository, milestoneRepository);
    }

    /**
     * 迁移并执行副作用，与应用层命令执行器的顺序一致
     */
    public List<RuleExecution> transition(TaskTransition transition, long taskId, long actorId, int expectedVersion) {
        TaskTransitionResult result = lifecycleService.transition(transition, taskId, actorId, expectedVersion);
        return dispatcher.dispatch(result);
    }
}
