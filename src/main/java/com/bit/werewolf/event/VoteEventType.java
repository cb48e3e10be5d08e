package com.bit.werewolf.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VoteEventType {
    VOTE_START("vote.start"),
    VOTE_REGISTER_BEFORE("vote.register.before"),
    VOTE_REGISTER_AFTER("vote.register.after"),
    VOTE_CHANGE_BEFORE("vote.change.before"),
    VOTE_CHANGE_AFTER("vote.change.after"),
    VOTE_COUNT_BEFORE("vote.count.before"),
    VOTE_COUNT_AFTER("vote.count.after"),
    RUNOFF_START("vote.runoff.start"),
    RUNOFF_RESULT("vote.runoff.result"),
    EXECUTION_BEFORE("execution.before"),
    EXECUTION_AFTER("execution.after"),
    EXECUTION_NONE("execution.none"),
    EXECUTION_ALL_BEFORE("execution.all.before"),
    EXECUTION_ALL_AFTER("execution.all.after"),
    ;

    private final String eventName;

    VoteEventType(String eventName) {
        this.eventName = eventName;
    }

    @JsonValue
    public String getEventName() {
        return eventName;
    }
}
