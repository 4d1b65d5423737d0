package com.tencent.taskboard.domain.milestone.repository;

import com.tencent.taskboard.domain.milestone.ActivationWrite;
import com.tencent.taskboard.domain.milestone.Milestone;
import com.tencent.taskboard.domain.milestone.MilestoneProgress;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;
import java.util.Optional;

/**
 * MilestoneRepository - 里程碑仓储接口
 *
 * @author taskboard
 */
public interface MilestoneRepository {

    Optional<Milestone> findById(@Positive long milestoneId);

    /**
     * 任务的有效里程碑：任务自身的 milestone_id，否则取所在卡片的 milestone_id
     *
     * @param taskId 任务 ID
     * @return 没有有效里程碑（需求池）时为空
     */
    Optional<Milestone> findEffectiveForTask(@Positive long taskId);

    /**
     * {@code SELECT ... FOR UPDATE} 锁定里程碑行，直到当前事务结束。
     * 同一里程碑的完成判定由此串行化，拿到锁后读到的是其他事务已提交的任务状态。
     *
     * @param milestoneId 里程碑 ID
     * @return 里程碑是否存在
     */
    boolean lockForUpdate(@Positive long milestoneId);

    /**
     * 项目中是否存在除指定里程碑以外的 active 里程碑
     */
    boolean existsOtherActive(@Positive long projectId, @Positive long milestoneId);

    /**
     * 条件写：{@code state = 'active', activated_at = now WHERE id = ? AND project_id = ? AND state = 'ready'}
     *
     * @return 写入结果，唯一约束冲突时返回 {@link ActivationWrite#ACTIVE_SLOT_TAKEN}
     */
    ActivationWrite markActive(@Positive long milestoneId, @Positive long projectId, @NotNull Instant now);

    /**
     * 条件写：{@code state = 'completed', completed_at = now WHERE id = ? AND state = 'active'}
     *
     * @return 是否有行被更新
     */
    boolean markCompleted(@Positive long milestoneId, @NotNull Instant now);

    /**
     * 挂在里程碑下的卡片数
     */
    int countCards(@Positive long milestoneId);

    /**
     * 有效里程碑为该里程碑的任务数（直接挂载或经由卡片）
     */
    int countTasks(@Positive long milestoneId);

    MilestoneProgress progressOf(@Positive long milestoneId);
}
