package com.tencent.taskboard.domain.milestone.service;

import com.tencent.taskboard.domain.milestone.Milestone;
import com.tencent.taskboard.domain.milestone.MilestoneProgress;
import com.tencent.taskboard.domain.milestone.repository.MilestoneRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * MilestoneCompletionService - 任务完成后重新计算有效里程碑是否完成
 *
 * @author taskboard
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MilestoneCompletionService {

    private final MilestoneRepository milestoneRepository;

    /**
     * 只推进 active 里程碑，completed 不会回退
     *
     * @param taskId 刚完成的任务
     * @return 本次被标记为 completed 的里程碑
     */
    public Optional<Milestone> recomputeForTask(long taskId) {
        Optional<Milestone> effective = milestoneRepository.findEffectiveForTask(taskId)
            .filter(Milestone::isActive);
        if (effective.isEmpty()) {
            return Optional.empty();
        }

        long milestoneId = effective.get().getId();
        // 并发完成最后几个任务时，后拿到锁的事务能看到先提交者的结果
        boolean stillActive = milestoneRepository.lockForUpdate(milestoneId)
            && milestoneRepository.findById(milestoneId).filter(Milestone::isActive).isPresent();
        if (!stillActive) {
            return Optional.empty();
        }
        MilestoneProgress progress = milestoneRepository.progressOf(milestoneId);
        if (!progress.isFinished()) {
            return Optional.empty();
        }
        if (!milestoneRepository.markCompleted(milestoneId, Instant.now())) {
            return Optional.empty();
        }

        log.info("Milestone [{}] completed after task [{}]", milestoneId, taskId);
        return milestoneRepository.findById(milestoneId);
    }
}
