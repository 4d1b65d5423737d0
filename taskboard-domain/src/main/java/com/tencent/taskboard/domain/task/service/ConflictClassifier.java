package com.tencent.taskboard.domain.task.service;

import com.tencent.taskboard.domain.task.LifecycleError;
import com.tencent.taskboard.domain.task.LifecycleException;
import com.tencent.taskboard.domain.task.Task;
import com.tencent.taskboard.domain.task.TaskStateMachine;
import com.tencent.taskboard.domain.task.TaskTransition;
import com.tencent.taskboard.domain.task.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * ConflictClassifier - 条件写失败后的冲突分类
 * <p>
 * 条件写返回零行时无法区分"行不存在""版本过期""被并发修改"，这里重新读取当前行给出具体错误：
 * 不存在 → NOT_FOUND；已完成 → INVALID_TRANSITION；已被认领 → ALREADY_CLAIMED（认领）或
 * NOT_AUTHORIZED（他人持有时的释放/完成）；未认领时释放/完成 → INVALID_TRANSITION；其余 → VERSION_CONFLICT。
 * </p>
 *
 * @author taskboard
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConflictClassifier {

    private final TaskRepository taskRepository;

    public LifecycleException classify(long taskId, long actorId, TaskTransition transition) {
        Optional<Task> current = taskRepository.findById(taskId);
        if (current.isEmpty()) {
            return new LifecycleException(LifecycleError.NOT_FOUND, "Task not found: " + taskId);
        }

        Task task = current.get();
        LifecycleError error = TaskStateMachine.check(task, actorId, transition)
            .orElse(LifecycleError.VERSION_CONFLICT);
        log.debug("Conditional {} of task [{}] by user [{}] failed, current status {} version {}: {}",
            transition, taskId, actorId, task.getStatus().getCode(), task.getVersion(), error);
        return TaskLifecycleService.rejection(error, task, actorId, transition);
    }
}
