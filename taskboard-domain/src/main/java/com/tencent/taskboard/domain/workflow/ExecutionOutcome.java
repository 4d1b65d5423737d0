package com.tencent.taskboard.domain.workflow;

import java.util.Arrays;

/**
 * ExecutionOutcome - 规则评估结果
 *
 * @author taskboard
 */
public enum ExecutionOutcome {

    APPLIED("applied"),

    SUPPRESSED("suppressed");

    private final String code;

    ExecutionOutcome(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ExecutionOutcome fromCode(String code) {
        return Arrays.stream(values())
            .filter(outcome -> outcome.code.equals(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown execution outcome: " + code));
    }
}
