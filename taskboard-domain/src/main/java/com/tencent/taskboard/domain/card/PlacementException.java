package com.tencent.taskboard.domain.card;

import com.tencent.taskboard.domain.exception.DomainException;

/**
 * PlacementException - 卡片位置变更异常
 *
 * @author taskboard
 */
public class PlacementException extends DomainException {

    private final PlacementError error;

    public PlacementException(PlacementError error, String message) {
        super(message);
        this.error = error;
    }

    @Override
    public PlacementError getError() {
        return error;
    }
}
