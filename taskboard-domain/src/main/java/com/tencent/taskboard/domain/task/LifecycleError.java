package com.tencent.taskboard.domain.task;

import com.tencent.taskboard.domain.exception.DomainError;

/**
 * LifecycleError - 任务生命周期错误
 *
 * @author taskboard
 */
public enum LifecycleError implements DomainError {
    NOT_FOUND,
    NOT_AUTHORIZED,
    INVALID_TRANSITION,
    ALREADY_CLAIMED,
    VERSION_CONFLICT,
    VALIDATION_ERROR
}
