package com.tencent.taskboard.client.dto;

/**
 * ErrorCode - 对外暴露的封闭错误集合
 * <p>
 * 每个错误码对应唯一的 HTTP 状态码。
 * </p>
 */
public enum ErrorCode {

    NOT_FOUND(404),

    /**
     * 非任务认领人尝试释放/完成
     */
    NOT_AUTHORIZED(403),

    /**
     * 当前状态不允许该操作
     */
    INVALID_TRANSITION(409),

    ALREADY_CLAIMED(409),

    /**
     * 版本号过期，重新获取后可重试
     */
    VERSION_CONFLICT(409),

    /**
     * 同项目内已有其他激活的里程碑
     */
    ALREADY_ACTIVE(409),

    VALIDATION_ERROR(422),

    STORAGE_ERROR(500);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * 调用方刷新数据后可直接重试
     */
    public boolean isRetryable() {
        return this == VERSION_CONFLICT || this == STORAGE_ERROR;
    }
}
