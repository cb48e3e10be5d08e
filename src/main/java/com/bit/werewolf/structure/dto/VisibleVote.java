package com.bit.werewolf.structure.dto;

import com.bit.werewolf.structure.vote.VoteType;
import com.bit.werewolf.structure.vote.WeightedVote;
import lombok.Builder;
import lombok.Value;

/**
 * 对某个观察者可见的一张票，匿名时 voterId 为null
 */
@Value
@Builder(toBuilder = true)
public class VisibleVote {
    Integer voterId;
    int targetId;
    VoteType voteType;
    int weight;
    long timestamp;

    public static VisibleVote of(WeightedVote vote) {
        return VisibleVote.builder()
                .voterId(vote.getVoterId())
                .targetId(vote.getTargetId())
                .voteType(vote.getVoteType())
                .weight(vote.getWeight().getValue())
                .timestamp(vote.getTimestamp())
                .build();
    }

    public VisibleVote anonymous() {
        return toBuilder().voterId(null).build();
    }
}
