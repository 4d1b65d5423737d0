package com.tencent.taskboard.domain.exception;

/**
 * DomainError - 领域错误码标记接口
 * <p>
 * 每个领域组件声明一个封闭的错误枚举并实现此接口，由应用层统一转换为对外错误码
 * </p>
 *
 * @author taskboard
 */
public interface DomainError {

    /**
     * 枚举常量名
     */
    String name();
}
