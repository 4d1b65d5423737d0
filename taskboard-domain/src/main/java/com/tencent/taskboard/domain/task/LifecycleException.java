package com.tencent.taskboard.domain.task;

import com.tencent.taskboard.domain.exception.DomainException;

/**
 * LifecycleException - 任务生命周期异常
 *
 * @author taskboard
 */
public class LifecycleException extends DomainException {

    private final LifecycleError error;

    public LifecycleException(LifecycleError error, String message) {
        super(message);
        this.error = error;
    }

    @Override
    public LifecycleError getError() {
        return error;
    }
}
