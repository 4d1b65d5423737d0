package com.tencent.taskboard.app.card;

import com.tencent.taskboard.app.card.executor.MoveCardCmdExe;
import com.tencent.taskboard.app.common.FacadeTemplate;
import com.tencent.taskboard.client.api.CardServiceI;
import com.tencent.taskboard.client.dto.SingleResponse;
import com.tencent.taskboard.client.dto.command.MoveCardCmd;
import com.tencent.taskboard.client.dto.data.CardDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CardServiceImpl implements CardServiceI {

    private final FacadeTemplate facadeTemplate;
    private final MoveCardCmdExe moveCardCmdExe;

    @Override
    public SingleResponse<CardDTO> moveCard(MoveCardCmd cmd) {
        return facadeTemplate.single(cmd, () -> moveCardCmdExe.execute(cmd));
    }
}
