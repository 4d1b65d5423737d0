package com.tencent.taskboard.domain.milestone;

import lombok.Value;

/**
 * ActivationSnapshot - 激活结果：激活后的里程碑以及随之放开的卡片、任务数量
 *
 * @author taskboard
 */
@Value
public class ActivationSnapshot {

    Milestone milestone;

    int cardsReleased;

    int tasksReleased;
}
