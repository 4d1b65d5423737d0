package com.tencent.taskboard.app.milestone.executor;

import com.tencent.taskboard.app.assembler.MilestoneAssembler;
import com.tencent.taskboard.client.dto.command.ActivateMilestoneCmd;
import com.tencent.taskboard.client.dto.data.ActivationDTO;
import com.tencent.taskboard.domain.milestone.service.MilestoneActivationService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * ActivateMilestoneCmdExe - 激活里程碑，项目行锁持有到事务提交
 *
 * @author taskboard
 */
@Component
@RequiredArgsConstructor
public class ActivateMilestoneCmdExe {

    private final MilestoneActivationService milestoneActivationService;

    @Transactional(rollbackFor = Exception.class)
    public ActivationDTO execute(ActivateMilestoneCmd cmd) {
        return MilestoneAssembler.toDTO(milestoneActivationService.activate(cmd.getMilestoneId(), cmd.getProjectId()));
    }
}
