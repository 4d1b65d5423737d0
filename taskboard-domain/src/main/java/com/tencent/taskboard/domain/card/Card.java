package com.tencent.taskboard.domain.card;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Card - 卡片
 * <p>
 * 卡片把一组任务聚在一起，milestoneId 为空时在项目需求池中
 * </p>
 *
 * @author taskboard
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Card {

    private Long id;

    private Long projectId;

    private Long milestoneId;

    private String title;

    private String description;

    private Long createdBy;

    private Instant createdAt;

    private Integer version;

    @Builder.Default
    private CardProgress progress = CardProgress.EMPTY;

    public CardState getState() {
        return progress.state();
    }

    public boolean isInPool() {
        return milestoneId == null;
    }
}
