package com.tencent.taskboard.domain.milestone;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Milestone - 里程碑
 * <p>
 * 同一项目内至多有一个 active 里程碑。
 * ready 时两个时间戳都为空，active 时仅 activatedAt 有值，completed 时都有值。
 * </p>
 *
 * @author taskboard
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Milestone {

    private Long id;

    private Long projectId;

    private String name;

    private String description;

    private MilestoneState state;

    /**
     * 项目内排序位置
     */
    private Integer position;

    private Long createdBy;

    private Instant createdAt;

    private Instant activatedAt;

    private Instant completedAt;

    public boolean isReady() {
        return state == MilestoneState.READY;
    }

    public boolean isActive() {
        return state == MilestoneState.ACTIVE;
    }

    public boolean isCompleted() {
        return state == MilestoneState.COMPLETED;
    }

    public boolean belongsTo(long projectId) {
        return this.projectId != null && this.projectId == projectId;
    }
}
