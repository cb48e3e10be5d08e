package com.bit.werewolf.structure.decision;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.google.common.collect.ImmutableList;
import lombok.Value;

/**
 * 处刑执行结果
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionOutcome {

    public static final String REASON_NO_EXECUTION = "no_execution";

    ExecutionDecision.Kind kind;
    int turn;
    ImmutableList<ExecutedPlayer> executed;
    //不处刑时的原因
    String reason;

    public static ExecutionOutcome none(int turn, String reason) {
        return new ExecutionOutcome(ExecutionDecision.Kind.NO_EXECUTION, turn, ImmutableList.of(), reason);
    }

    public int getCount() {
        return executed.size();
    }

    public boolean isExecuted() {
        return !executed.isEmpty();
    }
}
