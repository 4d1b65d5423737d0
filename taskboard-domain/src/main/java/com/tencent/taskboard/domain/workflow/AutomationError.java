package com.tencent.taskboard.domain.workflow;

import com.tencent.taskboard.domain.exception.DomainError;

/**
 * AutomationError - 规则自动化错误
 *
 * @author taskboard
 */
public enum AutomationError implements DomainError {

    /**
     * 模板的任务类型不属于事件所在项目
     */
    INVALID_TEMPLATE
}
