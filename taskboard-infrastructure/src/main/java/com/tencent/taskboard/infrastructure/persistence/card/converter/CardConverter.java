package com.tencent.taskboard.infrastructure.persistence.card.converter;

import com.tencent.taskboard.domain.card.Card;
import com.tencent.taskboard.domain.card.CardProgress;
import com.tencent.taskboard.infrastructure.persistence.card.entity.CardViewDO;

/**
 * CardConverter - 卡片转换器
 *
 * @author taskboard
 */
public class CardConverter {

    public static Card toDomain(CardViewDO dataObject) {
        if (dataObject == null) {
            return null;
        }

        return Card.builder()
            .id(dataObject.getId())
            .projectId(dataObject.getProjectId())
            .milestoneId(dataObject.getMilestoneId())
            .title(dataObject.getTitle())
            .description(dataObject.getDescription())
            .createdBy(dataObject.getCreatedBy())
            .createdAt(dataObject.getCreatedAt())
            .version(dataObject.getVersion())
            .progress(new CardProgress(
                count(dataObject.getTaskCount()),
                count(dataObject.getAvailableCount()),
                count(dataObject.getCompletedCount())))
            .build();
    }

    private static int count(Integer value) {
        return value == null ? 0 : value;
    }
}
