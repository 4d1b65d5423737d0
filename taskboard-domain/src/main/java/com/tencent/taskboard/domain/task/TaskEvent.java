package com.tencent.taskboard.domain.task;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * TaskEvent - 任务生命周期审计事件（只追加）
 *
 * @author taskboard
 */
@Value
@Builder
public class TaskEvent {

    Long projectId;

    Long taskId;

    Long actorUserId;

    /**
     * task_claimed / task_released / task_completed
     */
    String eventType;

    Instant createdAt;
}
