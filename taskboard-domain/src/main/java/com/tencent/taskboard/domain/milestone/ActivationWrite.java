package com.tencent.taskboard.domain.milestone;

/**
 * ActivationWrite - 激活条件写的结果
 *
 * @author taskboard
 */
public enum ActivationWrite {

    /**
     * 写入成功
     */
    ACTIVATED,

    /**
     * 条件不满足，零行被更新
     */
    NOT_MATCHED,

    /**
     * 违反项目内唯一 active 里程碑约束
     */
    ACTIVE_SLOT_TAKEN
}
