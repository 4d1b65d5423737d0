package com.tencent.taskboard.domain.milestone.service;

import com.tencent.taskboard.domain.milestone.ActivationError;
import com.tencent.taskboard.domain.milestone.ActivationException;
import com.tencent.taskboard.domain.milestone.ActivationSnapshot;
import com.tencent.taskboard.domain.milestone.ActivationWrite;
import com.tencent.taskboard.domain.milestone.Milestone;
import com.tencent.taskboard.domain.milestone.repository.MilestoneRepository;
import com.tencent.taskboard.domain.project.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * MilestoneActivationService - 里程碑激活
 * <p>
 * 必须在事务内调用：项目行锁把同一项目的激活串行化，唯一约束兜底保证至多一个 active 里程碑。
 * 激活本身就是"放开"：认领守卫读取同库中的里程碑状态，状态翻转后其下的卡片与任务即可认领。
 * </p>
 *
 * @author taskboard
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MilestoneActivationService {

    private final ProjectRepository projectRepository;
    private final MilestoneRepository milestoneRepository;

    public ActivationSnapshot activate(long milestoneId, long projectId) {
        if (!projectRepository.lockForUpdate(projectId)) {
            throw new ActivationException(ActivationError.NOT_FOUND, "Project not found: " + projectId);
        }

        Milestone milestone = milestoneRepository.findById(milestoneId)
            .filter(m -> m.belongsTo(projectId))
            .orElseThrow(() -> notFound(milestoneId, projectId));
        if (!milestone.isReady()) {
            throw new ActivationException(ActivationError.INVALID_TRANSITION,
                "Milestone " + milestoneId + " is " + milestone.getState().getCode() + ", expected ready");
        }
        if (milestoneRepository.existsOtherActive(projectId, milestoneId)) {
            throw new ActivationException(ActivationError.ALREADY_ACTIVE,
                "Project " + projectId + " already has an active milestone");
        }

        ActivationWrite write = milestoneRepository.markActive(milestoneId, projectId, Instant.now());
        if (write == ActivationWrite.ACTIVE_SLOT_TAKEN) {
            throw new ActivationException(ActivationError.ALREADY_ACTIVE,
                "Project " + projectId + " already has an active milestone");
        }
        if (write == ActivationWrite.NOT_MATCHED) {
            throw classifyNotMatched(milestoneId, projectId);
        }

        Milestone activated = milestoneRepository.findById(milestoneId)
            .orElseThrow(() -> notFound(milestoneId, projectId));
        int cards = milestoneRepository.countCards(milestoneId);
        int tasks = milestoneRepository.countTasks(milestoneId);
        log.info("Activated milestone [{}] in project [{}], released {} cards and {} tasks",
            milestoneId, projectId, cards, tasks);
        return new ActivationSnapshot(activated, cards, tasks);
    }

    private ActivationException classifyNotMatched(long milestoneId, long projectId) {
        Milestone current = milestoneRepository.findById(milestoneId)
            .filter(m -> m.belongsTo(projectId))
            .orElse(null);
        if (current == null) {
            return notFound(milestoneId, projectId);
        }
        if (current.isActive()) {
            return new ActivationException(ActivationError.ALREADY_ACTIVE,
                "Milestone " + milestoneId + " was activated concurrently");
        }
        return new ActivationException(ActivationError.INVALID_TRANSITION,
            "Milestone " + milestoneId + " is " + current.getState().getCode() + ", expected ready");
    }

    private static ActivationException notFound(long milestoneId, long projectId) {
        return new ActivationException(ActivationError.NOT_FOUND,
            "Milestone " + milestoneId + " not found in project " + projectId);
    }
}
