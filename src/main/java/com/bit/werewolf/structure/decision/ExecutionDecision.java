package com.bit.werewolf.structure.decision;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.collect.ImmutableList;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collection;

/**
 * 处刑决议
 * EXECUTE 处刑一人；NO_EXECUTION 不处刑；EXECUTE_ALL 处刑全部候选人；RUNOFF 需要决选
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExecutionDecision {

    public static final String ALL = "all";

    public enum Kind {
        EXECUTE,
        NO_EXECUTION,
        EXECUTE_ALL,
        RUNOFF
    }

    private static final ExecutionDecision NONE = new ExecutionDecision(Kind.NO_EXECUTION, null, ImmutableList.of());

    Kind kind;
    Integer target;
    ImmutableList<Integer> candidates;

    public static ExecutionDecision execute(int target) {
        return new ExecutionDecision(Kind.EXECUTE, target, ImmutableList.of(target));
    }

    public static ExecutionDecision noExecution() {
        return NONE;
    }

    public static ExecutionDecision executeAll(Collection<Integer> candidates) {
        return new ExecutionDecision(Kind.EXECUTE_ALL, null, ImmutableList.copyOf(candidates));
    }

    public static ExecutionDecision runoff(Collection<Integer> candidates) {
        return new ExecutionDecision(Kind.RUNOFF, null, ImmutableList.copyOf(candidates));
    }

    public boolean isNeedsRunoff() {
        return kind == Kind.RUNOFF;
    }

    /**
     * 事件里的 executionTarget：玩家ID、"all" 或 null
     */
    @JsonIgnore
    public Object getExecutionTarget() {
        switch (kind) {
            case EXECUTE:
                return target;
            case EXECUTE_ALL:
                return ALL;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case EXECUTE:
                return "EXECUTE(" + target + ")";
            case EXECUTE_ALL:
                return "EXECUTE_ALL" + candidates;
            case RUNOFF:
                return "RUNOFF" + candidates;
            default:
                return "NO_EXECUTION";
        }
    }
}
