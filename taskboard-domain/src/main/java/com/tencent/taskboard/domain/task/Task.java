package com.tencent.taskboard.domain.task;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Task - 任务聚合根
 * <p>
 * 任务属于一个项目，可挂在卡片下（card_id）或直接挂在里程碑下（milestone_id），两者互斥，
 * 都为空时在项目需求池中。所有生命周期迁移通过版本号做乐观并发控制。
 * </p>
 *
 * @author taskboard
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    private Long id;

    private Long projectId;

    /**
     * 任务类型，属于同一项目
     */
    private Long typeId;

    private Long cardId;

    private Long milestoneId;

    private String title;

    private String description;

    /**
     * 优先级 1..5
     */
    private Integer priority;

    private TaskStatus status;

    /**
     * 仅当 status = CLAIMED 时非空
     */
    private Long claimedBy;

    private Instant claimedAt;

    /**
     * 仅当 status = COMPLETED 时非空
     */
    private Instant completedAt;

    private Long createdBy;

    private Instant createdAt;

    /**
     * 由工作流规则生成时记录规则 ID
     */
    private Long createdFromRuleId;

    private Integer version;

    public boolean isClaimed() {
        return status == TaskStatus.CLAIMED;
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    public boolean isClaimedBy(long userId) {
        return isClaimed() && claimedBy != null && claimedBy == userId;
    }
}
