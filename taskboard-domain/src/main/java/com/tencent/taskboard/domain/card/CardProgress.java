package com.tencent.taskboard.domain.card;

import com.tencent.taskboard.domain.task.TaskStatus;
import lombok.Value;

/**
 * CardProgress - 卡片下任务的计数
 *
 * @author taskboard
 */
@Value
public class CardProgress {

    public static final CardProgress EMPTY = new CardProgress(0, 0, 0);

    int taskCount;

    int availableCount;

    int completedCount;

    public CardState state() {
        return CardState.derive(taskCount, availableCount, completedCount);
    }

    /**
     * 还原某个任务从 from 迁移到 to 之前的计数
     */
    public CardProgress revert(TaskStatus from, TaskStatus to) {
        int available = availableCount + delta(TaskStatus.AVAILABLE, from, to);
        int completed = completedCount + delta(TaskStatus.COMPLETED, from, to);
        return new CardProgress(taskCount, available, completed);
    }

    private static int delta(TaskStatus counted, TaskStatus from, TaskStatus to) {
        return (from == counted ? 1 : 0) - (to == counted ? 1 : 0);
    }
}
