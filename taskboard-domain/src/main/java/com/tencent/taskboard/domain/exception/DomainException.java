package com.tencent.taskboard.domain.exception;

/**
 * DomainException - 领域异常基类
 *
 * @author taskboard
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }

    /**
     * 携带的领域错误
     */
    public abstract DomainError getError();
}
