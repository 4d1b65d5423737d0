package com.tencent.taskboard.client.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Single Response with data
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class SingleResponse<T> extends Response {
    private T data;

    public static <T> SingleResponse<T> of(T data) {
        SingleResponse<T> response = new SingleResponse<>();
        response.setSuccess(true);
        response.setData(data);
        return response;
    }

    public static <T> SingleResponse<T> buildFailureWith(ErrorCode errCode, String errMessage) {
        SingleResponse<T> response = new SingleResponse<>();
        response.setSuccess(false);
        response.setErrCode(errCode.name());
        response.setErrMessage(errMessage);
        return response;
    }
}
