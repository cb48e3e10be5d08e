package com.bit.werewolf.structure.summary;

import com.bit.werewolf.structure.vote.BallotRecord;
import com.bit.werewolf.structure.vote.VoteType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.Value;

/**
 * 某一天某一类投票的汇总
 */
@Value
@Builder
public class TypeSummary {
    VoteType type;
    int turn;
    ImmutableList<BallotRecord> votes;
    ImmutableMap<Integer, Integer> counts;
    int maxCount;
    ImmutableList<Integer> maxVoted;

    @JsonProperty("isTie")
    public boolean isTie() {
        return maxVoted.size() > 1;
    }
}
