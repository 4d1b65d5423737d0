package com.tencent.taskboard.client.api;

import com.tencent.taskboard.client.dto.SingleResponse;
import com.tencent.taskboard.client.dto.command.MoveCardCmd;
import com.tencent.taskboard.client.dto.data.CardDTO;

public interface CardServiceI {

    SingleResponse<CardDTO> moveCard(MoveCardCmd cmd);
}
