package com.tencent.taskboard.domain.task;

import lombok.Value;

/**
 * TaskTransitionResult - 一次成功迁移的前后快照
 *
 * @author taskboard
 */
@Value
public class TaskTransitionResult {

    TaskTransition transition;

    TaskStatus previousStatus;

    Task task;

    /**
     * 触发迁移的用户，级联迁移时为空
     */
    Long triggeredBy;
}
