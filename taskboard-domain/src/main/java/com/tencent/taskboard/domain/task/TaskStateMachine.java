package com.tencent.taskboard.domain.task;

import java.util.Optional;

/**
 * TaskStateMachine - 任务状态机守卫
 * <p>
 * available --claim--> claimed --release--> available<br>
 * claimed --complete--> completed（终态）
 * </p>
 * 守卫只看读到的任务状态，不关心版本号；条件写失败后的冲突分类复用同一套判断。
 *
 * @author taskboard
 */
public final class TaskStateMachine {

    private TaskStateMachine() {
    }

    /**
     * 检查迁移是否允许
     *
     * @return 不允许时返回对应错误，允许时返回空
     */
    public static Optional<LifecycleError> check(Task task, long actorId, TaskTransition transition) {
        if (task.isCompleted()) {
            return Optional.of(LifecycleError.INVALID_TRANSITION);
        }
        if (transition == TaskTransition.CLAIM) {
            return task.isClaimed() ? Optional.of(LifecycleError.ALREADY_CLAIMED) : Optional.empty();
        }
        if (!task.isClaimed()) {
            return Optional.of(LifecycleError.INVALID_TRANSITION);
        }
        if (!task.isClaimedBy(actorId)) {
            return Optional.of(LifecycleError.NOT_AUTHORIZED);
        }
        return Optional.empty();
    }
}
