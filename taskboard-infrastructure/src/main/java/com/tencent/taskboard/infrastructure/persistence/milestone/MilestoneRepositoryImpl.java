package com.tencent.taskboard.infrastructure.persistence.milestone;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.tencent.taskboard.domain.milestone.ActivationWrite;
import com.tencent.taskboard.domain.milestone.Milestone;
import com.tencent.taskboard.domain.milestone.MilestoneProgress;
import com.tencent.taskboard.domain.milestone.MilestoneState;
import com.tencent.taskboard.domain.milestone.repository.MilestoneRepository;
import com.tencent.taskboard.infrastructure.persistence.milestone.converter.MilestoneConverter;
import com.tencent.taskboard.infrastructure.persistence.milestone.entity.MilestoneDO;
import com.tencent.taskboard.infrastructure.persistence.milestone.mapper.MilestoneMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;
import org.springframework.validation.annotation.Validated;

import java.time.Instant;
import java.util.Optional;

/**
 * MilestoneRepositoryImpl - 里程碑仓储实现
 * <p>
 * 激活写依赖数据库唯一索引保证每个项目至多一个 active 里程碑
 * </p>
 *
 * @author taskboard
 */
@Slf4j
@Repository
@Validated
public class MilestoneRepositoryImpl implements MilestoneRepository {

    private final MilestoneMapper milestoneMapper;

    public MilestoneRepositoryImpl(MilestoneMapper milestoneMapper) {
        this.milestoneMapper = milestoneMapper;
    }

    @Override
    public Optional<Milestone> findById(long milestoneId) {
        return Optional.ofNullable(MilestoneConverter.toDomain(milestoneMapper.selectById(milestoneId)));
    }

    @Override
    public Optional<Milestone> findEffectiveForTask(long taskId) {
        return Optional.ofNullable(MilestoneConverter.toDomain(milestoneMapper.selectEffectiveForTask(taskId)));
    }

    @Override
    public boolean lockForUpdate(long milestoneId) {
        return milestoneMapper.lockById(milestoneId) != null;
    }

    @Override
    public boolean existsOtherActive(long projectId, long milestoneId) {
        Long count = milestoneMapper.selectCount(
            new LambdaQueryWrapper<MilestoneDO>()
                .eq(MilestoneDO::getProjectId, projectId)
                .ne(MilestoneDO::getId, milestoneId)
                .eq(MilestoneDO::getState, MilestoneState.ACTIVE.getCode())
        );
        return count != null && count > 0;
    }

    @Override
    public ActivationWrite markActive(long milestoneId, long projectId, Instant now) {
        try {
            int updated = milestoneMapper.update(null, new LambdaUpdateWrapper<MilestoneDO>()
                .set(MilestoneDO::getState, MilestoneState.ACTIVE.getCode())
                .set(MilestoneDO::getActivatedAt, now)
                .eq(MilestoneDO::getId, milestoneId)
                .eq(MilestoneDO::getProjectId, projectId)
                .eq(MilestoneDO::getState, MilestoneState.READY.getCode()));
            return updated == 0 ? ActivationWrite.NOT_MATCHED : ActivationWrite.ACTIVATED;
        } catch (DuplicateKeyException e) {
            log.info("Active milestone slot of project {} already taken while activating {}", projectId, milestoneId);
            return ActivationWrite.ACTIVE_SLOT_TAKEN;
        }
    }

    @Override
    public boolean markCompleted(long milestoneId, Instant now) {
        int updated = milestoneMapper.update(null, new LambdaUpdateWrapper<MilestoneDO>()
            .set(MilestoneDO::getState, MilestoneState.COMPLETED.getCode())
            .set(MilestoneDO::getCompletedAt, now)
            .eq(MilestoneDO::getId, milestoneId)
            .eq(MilestoneDO::getState, MilestoneState.ACTIVE.getCode()));
        return updated > 0;
    }

    @Override
    public int countCards(long milestoneId) {
        return milestoneMapper.countCards(milestoneId);
    }

    @Override
    public int countTasks(long milestoneId) {
        return milestoneMapper.countTasks(milestoneId);
    }

    @Override
    public MilestoneProgress progressOf(long milestoneId) {
        return MilestoneConverter.progressToDomain(milestoneMapper.selectProgress(milestoneId));
    }
}
