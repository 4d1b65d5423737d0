package com.tencent.taskboard.domain.card;

/**
 * CardState - 卡片状态，由卡片下任务的状态推导，不落库
 *
 * @author taskboard
 */
public enum CardState {

    /**
     * 没有任务离开过 available（包括空卡片）
     */
    PENDING("pending"),

    IN_PROGRESS("in_progress"),

    /**
     * 至少一个任务且全部完成
     */
    CLOSED("closed");

    private final String code;

    CardState(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static CardState derive(int taskCount, int availableCount, int completedCount) {
        if (taskCount > 0 && completedCount == taskCount) {
            return CLOSED;
        }
        if (availableCount == taskCount) {
            return PENDING;
        }
        return IN_PROGRESS;
    }
}
