package com.tencent.taskboard.domain.milestone;

import lombok.Value;

/**
 * MilestoneProgress - 里程碑内容完成度
 * <p>
 * 内容 = 挂在里程碑下的卡片 + 直接挂在里程碑下的任务。空卡片视为未完成。
 * </p>
 *
 * @author taskboard
 */
@Value
public class MilestoneProgress {

    int cardsTotal;

    int cardsClosed;

    int tasksTotal;

    int tasksCompleted;

    public boolean isEmpty() {
        return cardsTotal + tasksTotal == 0;
    }

    public boolean isFinished() {
        return !isEmpty() && cardsClosed == cardsTotal && tasksCompleted == tasksTotal;
    }
}
