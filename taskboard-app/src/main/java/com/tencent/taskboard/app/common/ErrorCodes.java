package com.tencent.taskboard.app.common;

import com.tencent.taskboard.client.dto.ErrorCode;
import com.tencent.taskboard.domain.card.PlacementError;
import com.tencent.taskboard.domain.exception.DomainError;
import com.tencent.taskboard.domain.milestone.ActivationError;
import com.tencent.taskboard.domain.task.LifecycleError;
import com.tencent.taskboard.domain.workflow.AutomationError;

/**
 * ErrorCodes - 领域错误到对外错误码的唯一转换点
 *
 * @author taskboard
 */
public final class ErrorCodes {

    private ErrorCodes() {
    }

    public static ErrorCode of(DomainError error) {
        if (error instanceof LifecycleError) {
            return of((LifecycleError) error);
        }
        if (error instanceof ActivationError) {
            return of((ActivationError) error);
        }
        if (error instanceof PlacementError) {
            return of((PlacementError) error);
        }
        if (error instanceof AutomationError) {
            return ErrorCode.VALIDATION_ERROR;
        }
        throw new IllegalArgumentException("Unmapped domain error: " + error.getClass().getSimpleName()
            + "." + error.name());
    }

    private static ErrorCode of(LifecycleError error) {
        switch (error) {
            case NOT_FOUND:
                return ErrorCode.NOT_FOUND;
            case NOT_AUTHORIZED:
                return ErrorCode.NOT_AUTHORIZED;
            case INVALID_TRANSITION:
                return ErrorCode.INVALID_TRANSITION;
            case ALREADY_CLAIMED:
                return ErrorCode.ALREADY_CLAIMED;
            case VERSION_CONFLICT:
                return ErrorCode.VERSION_CONFLICT;
            default:
                return ErrorCode.VALIDATION_ERROR;
        }
    }

    private static ErrorCode of(ActivationError error) {
        switch (error) {
            case NOT_FOUND:
                return ErrorCode.NOT_FOUND;
            case ALREADY_ACTIVE:
                return ErrorCode.ALREADY_ACTIVE;
            default:
                return ErrorCode.INVALID_TRANSITION;
        }
    }

    private static ErrorCode of(PlacementError error) {
        switch (error) {
            case NOT_FOUND:
                return ErrorCode.NOT_FOUND;
            case VERSION_CONFLICT:
                return ErrorCode.VERSION_CONFLICT;
            default:
                return ErrorCode.VALIDATION_ERROR;
        }
    }
}
