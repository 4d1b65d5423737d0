package com.tencent.taskboard.domain.card;

import com.tencent.taskboard.domain.exception.DomainError;

/**
 * PlacementError - 卡片位置变更错误
 *
 * @author taskboard
 */
public enum PlacementError implements DomainError {
    NOT_FOUND,
    INVALID_PLACEMENT,
    VERSION_CONFLICT
}
