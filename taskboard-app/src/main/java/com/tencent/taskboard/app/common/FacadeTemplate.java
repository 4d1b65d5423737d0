package com.tencent.taskboard.app.common;

import com.tencent.taskboard.client.dto.ErrorCode;
import com.tencent.taskboard.client.dto.MultiResponse;
import com.tencent.taskboard.client.dto.Response;
import com.tencent.taskboard.client.dto.SingleResponse;
import com.tencent.taskboard.domain.exception.DomainException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * FacadeTemplate - 门面统一的校验、异常转换与日志
 * <p>
 * 命令先做 Bean Validation，失败时不触达存储；领域异常经 {@link ErrorCodes} 转为错误码，
 * Spring 数据访问异常统一为 STORAGE_ERROR。
 * </p>
 *
 * @author taskboard
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FacadeTemplate {

    private final Validator validator;

    public <T> SingleResponse<T> single(Object command, Supplier<T> body) {
        return execute(command, () -> SingleResponse.of(body.get()), SingleResponse::buildFailureWith);
    }

    public <T> MultiResponse<T> multi(Object command, Supplier<? extends Collection<T>> body) {
        return execute(command, () -> MultiResponse.of(body.get()), MultiResponse::buildFailureWith);
    }

    public <R extends Response> R execute(Object command, Supplier<R> body,
                                          BiFunction<ErrorCode, String, R> failure) {
        Set<ConstraintViolation<Object>> violations = validator.validate(command);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
            log.info("Rejected {}: {}", command.getClass().getSimpleName(), message);
            return failure.apply(ErrorCode.VALIDATION_ERROR, message);
        }

        try {
            return body.get();
        } catch (DomainException e) {
            ErrorCode code = ErrorCodes.of(e.getError());
            log.info("{} failed with {}: {}", command.getClass().getSimpleName(), code, e.getMessage());
            return failure.apply(code, e.getMessage());
        } catch (DataAccessException e) {
            log.error("{} failed on storage access", command.getClass().getSimpleName(), e);
            return failure.apply(ErrorCode.STORAGE_ERROR, "Storage unavailable, retry later");
        }
    }
}
