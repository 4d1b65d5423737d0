package com.tencent.taskboard.domain.milestone;

import com.tencent.taskboard.domain.exception.DomainException;

/**
 * ActivationException - 里程碑激活异常
 *
 * @author taskboard
 */
public class ActivationException extends DomainException {

    private final ActivationError error;

    public ActivationException(ActivationError error, String message) {
        super(message);
        this.error = error;
    }

    @Override
    public ActivationError getError() {
        return error;
    }
}
