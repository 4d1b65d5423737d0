package com.tencent.taskboard.domain.task;

import java.time.Instant;

/**
 * TaskTransition - 任务生命周期迁移
 *
 * @author taskboard
 */
public enum TaskTransition {

    CLAIM(TaskStatus.CLAIMED, "task_claimed"),

    RELEASE(TaskStatus.AVAILABLE, "task_released"),

    COMPLETE(TaskStatus.COMPLETED, "task_completed");

    private final TaskStatus target;

    private final String eventType;

    TaskTransition(TaskStatus target, String eventType) {
        this.target = target;
        this.eventType = eventType;
    }

    public TaskStatus getTarget() {
        return target;
    }

    /**
     * 审计事件类型
     */
    public String getEventType() {
        return eventType;
    }

    /**
     * 构造迁移后的字段
     *
     * @param current 迁移前的任务
     * @param actorId 操作人
     * @param now 迁移时间
     */
    public TaskMutation mutation(Task current, long actorId, Instant now) {
        switch (this) {
            case CLAIM:
                return TaskMutation.builder()
                    .status(TaskStatus.CLAIMED)
                    .claimedBy(actorId)
                    .claimedAt(now)
                    .build();
            case RELEASE:
                return TaskMutation.builder()
                    .status(TaskStatus.AVAILABLE)
                    .build();
            case COMPLETE:
                // keep claimed_at as a record of when work started
                return TaskMutation.builder()
                    .status(TaskStatus.COMPLETED)
                    .claimedAt(current.getClaimedAt())
                    .completedAt(now)
                    .build();
            default:
                throw new IllegalStateException("Unhandled transition: " + this);
        }
    }
}
