package com.tencent.taskboard.domain.card;

import lombok.Value;

/**
 * CardMutation - 卡片条件写入的字段
 *
 * @author taskboard
 */
@Value
public class CardMutation {

    /**
     * 目标里程碑，为空表示需求池
     */
    Long milestoneId;
}
