package com.tencent.taskboard.domain.task;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * TaskMutation - 一次生命周期迁移写入的字段集合
 * <p>
 * 四个字段总是整体写入，保证 claimed_by 与 status、completed_at 与 status 的一致性
 * </p>
 *
 * @author taskboard
 */
@Value
@Builder
public class TaskMutation {

    TaskStatus status;

    Long claimedBy;

    Instant claimedAt;

    Instant completedAt;
}
