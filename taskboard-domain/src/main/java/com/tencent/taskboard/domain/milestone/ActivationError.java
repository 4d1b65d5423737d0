package com.tencent.taskboard.domain.milestone;

import com.tencent.taskboard.domain.exception.DomainError;

/**
 * ActivationError - 里程碑激活错误
 *
 * @author taskboard
 */
public enum ActivationError implements DomainError {
    NOT_FOUND,
    INVALID_TRANSITION,
    ALREADY_ACTIVE
}
