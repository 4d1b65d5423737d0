package com.tencent.taskboard.infrastructure.persistence.card.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * CardViewDO - 卡片及其任务计数
 *
 * @author taskboard
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class CardViewDO extends CardDO {

    private Integer taskCount;

    private Integer availableCount;

    private Integer completedCount;
}
