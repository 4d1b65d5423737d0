package com.tencent.taskboard.client.dto;

import lombok.Data;

import java.io.Serializable;

/**
 * Response - 服务门面统一返回结构
 * <p>
 * 失败时 errCode 取值于 {@link ErrorCode}，HTTP 层据此一一映射状态码。
 * </p>
 */
@Data
public class Response implements Serializable {
    private static final long serialVersionUID = 1L;

    private boolean success = true;
    private String errCode;
    private String errMessage;

    public static Response buildSuccess() {
        Response response = new Response();
        response.setSuccess(true);
        return response;
    }

    public static Response buildFailure(ErrorCode errCode, String errMessage) {
        Response response = new Response();
        response.setSuccess(false);
        response.setErrCode(errCode.name());
        response.setErrMessage(errMessage);
        return response;
    }

    /**
     * 解析失败码，成功响应返回 null
     */
    public ErrorCode errorCode() {
        return errCode == null ? null : ErrorCode.valueOf(errCode);
    }
}
