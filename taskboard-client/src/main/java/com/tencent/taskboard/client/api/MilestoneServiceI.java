package com.tencent.taskboard.client.api;

import com.tencent.taskboard.client.dto.SingleResponse;
import com.tencent.taskboard.client.dto.command.ActivateMilestoneCmd;
import com.tencent.taskboard.client.dto.data.ActivationDTO;

public interface MilestoneServiceI {

    SingleResponse<ActivationDTO> activate(ActivateMilestoneCmd cmd);
}
