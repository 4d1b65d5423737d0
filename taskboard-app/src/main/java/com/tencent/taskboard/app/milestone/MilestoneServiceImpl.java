package com.tencent.taskboard.app.milestone;

import com.tencent.taskboard.app.common.FacadeTemplate;
import com.tencent.taskboard.app.milestone.executor.ActivateMilestoneCmdExe;
import com.tencent.taskboard.client.api.MilestoneServiceI;
import com.tencent.taskboard.client.dto.SingleResponse;
import com.tencent.taskboard.client.dto.command.ActivateMilestoneCmd;
import com.tencent.taskboard.client.dto.data.ActivationDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MilestoneServiceImpl implements MilestoneServiceI {

    private final FacadeTemplate facadeTemplate;
    private final ActivateMilestoneCmdExe activateMilestoneCmdExe;

    @Override
    public SingleResponse<ActivationDTO> activate(ActivateMilestoneCmd cmd) {
        return facadeTemplate.single(cmd, () -> activateMilestoneCmdExe.execute(cmd));
    }
}
