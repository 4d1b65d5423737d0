package com.tencent.taskboard.app.assembler;

import com.tencent.taskboard.client.dto.data.CardDTO;
import com.tencent.taskboard.domain.card.Card;

/**
 * CardAssembler - 卡片领域对象转 DTO
 *
 * @author taskboard
 */
public class CardAssembler {

    public static CardDTO toDTO(Card card) {
        CardDTO dto = new CardDTO();
        dto.setId(card.getId());
        dto.setProjectId(card.getProjectId());
        dto.setMilestoneId(card.getMilestoneId());
        dto.setTitle(card.getTitle());
        dto.setDescription(card.getDescription());
        dto.setState(card.getState().getCode());
        dto.setTaskCount(card.getProgress().getTaskCount());
        dto.setAvailableCount(card.getProgress().getAvailableCount());
        dto.setCompletedCount(card.getProgress().getCompletedCount());
        dto.setVersion(card.getVersion());
        return dto;
    }
}
