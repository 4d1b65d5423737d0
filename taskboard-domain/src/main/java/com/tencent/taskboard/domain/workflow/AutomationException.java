package com.tencent.taskboard.domain.workflow;

import com.tencent.taskboard.domain.exception.DomainException;

/**
 * AutomationException - 规则自动化异常，抛出时触发迁移整体回滚
 *
 * @author taskboard
 */
public class AutomationException extends DomainException {

    private final AutomationError error;

    public AutomationException(AutomationError error, String message) {
        super(message);
        this.error = error;
    }

    @Override
    public AutomationError getError() {
        return error;
    }
}
