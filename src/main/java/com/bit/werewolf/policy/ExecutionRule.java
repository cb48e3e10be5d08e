package com.bit.werewolf.policy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 平票处理规则
 */
public enum ExecutionRule {
    /** 决选投票 */
    RUNOFF("runoff"),
    /** 平票者中随机选一人 */
    RANDOM("random"),
    /** 不处刑 */
    NO_EXECUTION("no_execution"),
    /** 平票者全部处刑 */
    ALL_EXECUTION("all_execution"),
    /** 配置值无法识别，由各决策点套用各自的默认规则 */
    UNRECOGNIZED("unrecognized"),

    ;

    private final String value;

    ExecutionRule(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 解析配置值，兼容 no-execution / NO_EXECUTION 写法
     * 无法识别时返回 UNRECOGNIZED，不抛异常
     */
    public static ExecutionRule fromValue(String value) {
        if (value == null) {
            return UNRECOGNIZED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ExecutionRule rule : values()) {
            if (rule != UNRECOGNIZED && rule.value.equals(normalized)) {
                return rule;
            }
        }
        return UNRECOGNIZED;
    }
}
