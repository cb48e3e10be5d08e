package com.bit.werewolf.structure.round;

import com.bit.werewolf.policy.VotingPolicy;
import com.bit.werewolf.structure.vote.Ballot;
import com.bit.werewolf.structure.vote.BallotRecord;
import com.bit.werewolf.structure.vote.VoteType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一轮投票：可投票者、可投对象和每人当前的一张票
 * 由 BallotBox 持有，计票后只读
 */
@Getter
public class VoteRound {

    private final VoteType voteType;

    private final int turn;

    private final ImmutableSet<Integer> voters;

    private final ImmutableSet<Integer> targets;

    /**
     * 自定义对象的轮次，不检查对象是否在 targets 中
     */
    private final boolean relaxedTargets;

    private final VotingPolicy policy;

    //按投票顺序
    @Getter(AccessLevel.NONE)
    private final Map<Integer, Ballot> ballots = new LinkedHashMap<>();

    private boolean tallied;

    public VoteRound(VoteType voteType, int turn, Iterable<Integer> voters, Iterable<Integer> targets,
                     boolean relaxedTargets, VotingPolicy policy) {
        this.voteType = voteType;
        this.turn = turn;
        this.voters = ImmutableSet.copyOf(voters);
        this.targets = ImmutableSet.copyOf(targets);
        this.relaxedTargets = relaxedTargets;
        this.policy = policy;
    }

    /**
     * @return 该投票者当前选票的快照，未投票时为null
     */
    public BallotRecord getBallot(int voterId) {
        Ballot ballot = ballots.get(voterId);
        return ballot == null ? null : ballot.toRecord();
    }

    public void putBallot(Ballot ballot) {
        ballots.put(ballot.getVoterId(), ballot);
    }

    /**
     * 修改已登记选票的对象，投票顺序不变
     * @return 修改后的快照，未投票时为null
     */
    public BallotRecord changeTarget(int voterId, int newTargetId) {
        Ballot ballot = ballots.get(voterId);
        if (ballot == null) {
            return null;
        }
        ballot.changeTarget(newTargetId);
        return ballot.toRecord();
    }

    public ImmutableList<BallotRecord> currentBallots() {
        ImmutableList.Builder<BallotRecord> records = ImmutableList.builder();
        for (Ballot ballot : ballots.values()) {
            records.add(ballot.toRecord());
        }
        return records.build();
    }

    public int submittedCount() {
        return ballots.size();
    }

    public void markTallied() {
        this.tallied = true;
    }
}
