package com.bit.werewolf.structure.vote;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 选票快照，登记或变更时生成，写入历史后永不修改
 */
@Value
@Builder
@Jacksonized
public class BallotRecord implements WeightedVote {
    int voterId;
    int targetId;
    VoteType voteType;
    VoteWeight weight;
    int turn;
    long timestamp;

    public static BallotRecord of(WeightedVote vote) {
        if (vote instanceof BallotRecord) {
            return (BallotRecord) vote;
        }
        return BallotRecord.builder()
                .voterId(vote.getVoterId())
                .targetId(vote.getTargetId())
                .voteType(vote.getVoteType())
                .weight(vote.getWeight())
                .turn(vote.getTurn())
                .timestamp(vote.getTimestamp())
                .build();
    }
}
