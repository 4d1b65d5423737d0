package com.tencent.taskboard.domain.workflow;

import java.util.Arrays;

/**
 * ResourceType - 规则监听的资源类型
 *
 * @author taskboard
 */
public enum ResourceType {

    TASK("task"),

    CARD("card");

    private final String code;

    ResourceType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ResourceType fromCode(String code) {
        return Arrays.stream(values())
            .filter(type -> type.code.equals(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown resource type: " + code));
    }
}
