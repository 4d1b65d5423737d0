package com.tencent.taskboard.domain.workflow;

import java.util.Arrays;

/**
 * SuppressionReason - 规则被抑制的原因，按检查顺序排列
 *
 * @author taskboard
 */
public enum SuppressionReason {

    /**
     * 规则或所属工作流在评估时已停用
     */
    INACTIVE("inactive"),

    /**
     * 级联触发（没有触发用户），而规则只响应用户操作
     */
    NOT_USER_TRIGGERED("not_user_triggered"),

    /**
     * 附加条件不成立
     */
    NOT_MATCHING("not_matching"),

    /**
     * 同一来源已经应用过该规则
     */
    IDEMPOTENT("idempotent");

    private final String code;

    SuppressionReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static SuppressionReason fromCode(String code) {
        return Arrays.stream(values())
            .filter(reason -> reason.code.equals(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown suppression reason: " + code));
    }
}
