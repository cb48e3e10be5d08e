package com.bit.werewolf.structure.vote;

/**
 * 可计票的票：进行中的 Ballot 和历史中的 BallotRecord 都实现它，
 * 两者计票结果一致
 */
public interface WeightedVote {

    int getVoterId();

    int getTargetId();

    VoteType getVoteType();

    VoteWeight getWeight();

    int getTurn();

    long getTimestamp();
}
