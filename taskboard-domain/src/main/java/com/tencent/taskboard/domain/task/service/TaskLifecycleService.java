package com.tencent.taskboard.domain.task.service;

import com.tencent.taskboard.domain.milestone.Milestone;
import com.tencent.taskboard.domain.milestone.repository.MilestoneRepository;
import com.tencent.taskboard.domain.task.LifecycleError;
import com.tencent.taskboard.domain.task.LifecycleException;
import com.tencent.taskboard.domain.task.Task;
import com.tencent.taskboard.domain.task.TaskStateMachine;
import com.tencent.taskboard.domain.task.TaskStatus;
import com.tencent.taskboard.domain.task.TaskTransition;
import com.tencent.taskboard.domain.task.TaskTransitionResult;
import com.tencent.taskboard.domain.task.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * TaskLifecycleService - 任务生命周期领域服务
 * <p>
 * 读取 → 守卫 → 条件写；条件写失败时交给 {@link ConflictClassifier} 给出具体错误。
 * 守卫失败在任何写入之前返回。
 * </p>
 *
 * @author taskboard
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskLifecycleService {

    private final TaskRepository taskRepository;
    private final MilestoneRepository milestoneRepository;
    private final ConflictClassifier conflictClassifier;

    public TaskTransitionResult claim(long taskId, long actorId, int expectedVersion) {
        return transition(TaskTransition.CLAIM, taskId, actorId, expectedVersion);
    }

    public TaskTransitionResult release(long taskId, long actorId, int expectedVersion) {
        return transition(TaskTransition.RELEASE, taskId, actorId, expectedVersion);
    }

    public TaskTransitionResult complete(long taskId, long actorId, int expectedVersion) {
        return transition(TaskTransition.COMPLETE, taskId, actorId, expectedVersion);
    }

    public TaskTransitionResult transition(TaskTransition transition, long taskId, long actorId, int expectedVersion) {
        validate(taskId, actorId, expectedVersion);

        Task current = taskRepository.findById(taskId)
            .orElseThrow(() -> new LifecycleException(LifecycleError.NOT_FOUND, "Task not found: " + taskId));
        Optional<LifecycleError> rejected = TaskStateMachine.check(current, actorId, transition);
        if (rejected.isPresent()) {
            throw rejection(rejected.get(), current, actorId, transition);
        }
        if (transition == TaskTransition.CLAIM) {
            checkReleased(current);
        }

        Task updated = taskRepository
            .updateIfVersion(taskId, expectedVersion, transition.mutation(current, actorId, Instant.now()))
            .orElseThrow(() -> conflictClassifier.classify(taskId, actorId, transition));
        log.info("Task [{}] {} -> {} by user [{}], version {}", taskId, current.getStatus().getCode(),
            updated.getStatus().getCode(), actorId, updated.getVersion());
        return new TaskTransitionResult(transition, current.getStatus(), updated, actorId);
    }

    /**
     * 释放用户在项目中持有的全部任务（成员被移出项目时）。
     * 产生的迁移没有触发用户，只响应用户操作的规则会记录 not_user_triggered。
     * 每个任务条件写成功后立即回调 afterRelease，下一个任务的写入在回调返回之后，
     * 回调中读到的卡片计数只包含到当前任务为止的释放。
     *
     * @param afterRelease 单个任务的迁移副作用
     * @return 被释放的任务，按任务 ID 升序
     */
    public List<TaskTransitionResult> releaseAllForUser(long projectId, long userId,
                                                        Consumer<TaskTransitionResult> afterRelease) {
        if (projectId <= 0 || userId <= 0) {
            throw new LifecycleException(LifecycleError.VALIDATION_ERROR,
                "Project and user ids must be positive: project=" + projectId + ", user=" + userId);
        }

        List<Task> held = taskRepository.lockClaimedBy(projectId, userId);
        Instant now = Instant.now();
        List<TaskTransitionResult> released = new ArrayList<>(held.size());
        for (Task task : held) {
            Optional<Task> updated = taskRepository.updateIfVersion(task.getId(), task.getVersion(),
                TaskTransition.RELEASE.mutation(task, userId, now));
            if (updated.isEmpty()) {
                log.warn("Task [{}] changed while releasing tasks of user [{}], skipped", task.getId(), userId);
                continue;
            }
            TaskTransitionResult result = new TaskTransitionResult(
                TaskTransition.RELEASE, TaskStatus.CLAIMED, updated.get(), null);
            afterRelease.accept(result);
            released.add(result);
        }
        log.info("Released {} tasks held by user [{}] in project [{}]", released.size(), userId, projectId);
        return released;
    }

    private void checkReleased(Task task) {
        Optional<Milestone> parked = milestoneRepository.findEffectiveForTask(task.getId())
            .filter(Milestone::isReady);
        if (parked.isPresent()) {
            throw new LifecycleException(LifecycleError.INVALID_TRANSITION,
                "Task " + task.getId() + " belongs to milestone " + parked.get().getId() + " which is not active yet");
        }
    }

    private static void validate(long taskId, long actorId, int expectedVersion) {
        if (taskId <= 0 || actorId <= 0) {
            throw new LifecycleException(LifecycleError.VALIDATION_ERROR,
                "Task and actor ids must be positive: task=" + taskId + ", actor=" + actorId);
        }
        if (expectedVersion < 1) {
            throw new LifecycleException(LifecycleError.VALIDATION_ERROR,
                "Expected version must be at least 1, got " + expectedVersion);
        }
    }

    static LifecycleException rejection(LifecycleError error, Task task, long actorId, TaskTransition transition) {
        String action = transition.name().toLowerCase();
        switch (error) {
            case INVALID_TRANSITION:
                return new LifecycleException(error,
                    "Cannot " + action + " task " + task.getId() + " in status " + task.getStatus().getCode());
            case ALREADY_CLAIMED:
                return new LifecycleException(error,
                    "Task " + task.getId() + " is already claimed by user " + task.getClaimedBy());
            case NOT_AUTHORIZED:
                return new LifecycleException(error,
                    "User " + actorId + " cannot " + action + " task " + task.getId() + " claimed by another user");
            case VERSION_CONFLICT:
                return new LifecycleException(error,
                    "Task " + task.getId() + " was modified concurrently, current version " + task.getVersion());
            default:
                return new LifecycleException(error, "Cannot " + action + " task " + task.getId());
        }
    }
}
