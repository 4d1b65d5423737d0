package com.tencent.taskboard.domain.milestone;

import java.util.Arrays;

/**
 * MilestoneState - 里程碑状态，只能前进：ready -> active -> completed
 *
 * @author taskboard
 */
public enum MilestoneState {

    READY("ready"),

    ACTIVE("active"),

    COMPLETED("completed");

    private final String code;

    MilestoneState(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static MilestoneState fromCode(String code) {
        return Arrays.stream(values())
            .filter(state -> state.code.equals(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown milestone state: " + code));
    }
}
