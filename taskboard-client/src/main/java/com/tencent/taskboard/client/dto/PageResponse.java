package com.tencent.taskboard.client.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Paged response, pageIndex starts at 1
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class PageResponse<T> extends Response {
    private long totalCount;
    private int pageSize;
    private int pageIndex;
    private List<T> data = new ArrayList<>();

    public static <T> PageResponse<T> of(Collection<T> data, long totalCount, int pageSize, int pageIndex) {
        PageResponse<T> response = new PageResponse<>();
        response.setSuccess(true);
        response.setData(new ArrayList<>(data));
        response.setTotalCount(totalCount);
        response.setPageSize(pageSize);
        response.setPageIndex(pageIndex);
        return response;
    }

    public static <T> PageResponse<T> buildFailureWith(ErrorCode errCode, String errMessage) {
        PageResponse<T> response = new PageResponse<>();
        response.setSuccess(false);
        response.setErrCode(errCode.name());
        response.setErrMessage(errMessage);
        return response;
    }
}
