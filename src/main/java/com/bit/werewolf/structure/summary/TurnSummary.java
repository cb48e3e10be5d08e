package com.bit.werewolf.structure.summary;

import com.bit.werewolf.structure.vote.VoteType;
import com.google.common.collect.ImmutableMap;
import lombok.Value;

@Value
public class TurnSummary {
    int turn;
    ImmutableMap<VoteType, TypeSummary> types;
    SummaryResult results;

    public TypeSummary get(VoteType type) {
        return types.get(type);
    }
}
