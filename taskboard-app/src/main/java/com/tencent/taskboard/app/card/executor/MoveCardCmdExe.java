package com.tencent.taskboard.app.card.executor;

import com.tencent.taskboard.app.assembler.CardAssembler;
import com.tencent.taskboard.client.dto.FieldPatch;
import com.tencent.taskboard.client.dto.command.MoveCardCmd;
import com.tencent.taskboard.client.dto.data.CardDTO;
import com.tencent.taskboard.domain.card.CardPlacement;
import com.tencent.taskboard.domain.card.service.CardPlacementService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * MoveCardCmdExe - 调整卡片所属里程碑
 *
 * @author taskboard
 */
@Component
@RequiredArgsConstructor
public class MoveCardCmdExe {

    private final CardPlacementService cardPlacementService;

    @Transactional(rollbackFor = Exception.class)
    public CardDTO execute(MoveCardCmd cmd) {
        CardPlacement placement = toPlacement(cmd.getMilestoneId());
        return CardAssembler.toDTO(cardPlacementService.move(cmd.getCardId(), cmd.getExpectedVersion(), placement));
    }

    static CardPlacement toPlacement(FieldPatch<Long> milestoneId) {
        if (!milestoneId.isPresent()) {
            return CardPlacement.keep();
        }
        return milestoneId.value()
            .map(CardPlacement::milestone)
            .orElseGet(CardPlacement::pool);
    }
}
