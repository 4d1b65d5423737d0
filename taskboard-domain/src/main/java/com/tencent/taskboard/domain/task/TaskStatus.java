package com.tencent.taskboard.domain.task;

import java.util.Arrays;

/**
 * TaskStatus - 任务状态枚举
 *
 * @author taskboard
 */
public enum TaskStatus {

    /**
     * 可认领
     */
    AVAILABLE("available"),

    /**
     * 已被某个成员认领
     */
    CLAIMED("claimed"),

    /**
     * 已完成，终态
     */
    COMPLETED("completed");

    private final String code;

    TaskStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static TaskStatus fromCode(String code) {
        return Arrays.stream(values())
            .filter(status -> status.code.equals(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown task status: " + code));
    }
}
