package com.bit.werewolf.structure.vote;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 投票类型，标识选票属于哪一轮
 */
public enum VoteType {
    EXECUTION("execution"),  // 白天处刑投票
    RUNOFF("runoff"),        // 决选投票
    SPECIAL("special");      // 特殊投票（不受阶段限制，可自定义对象）

    private final String value;

    VoteType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static VoteType fromValue(String value) {
        for (VoteType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的投票类型：" + value);
    }
}
