package com.bit.werewolf.ballot;

import com.bit.werewolf.policy.VotingPolicy;
import com.bit.werewolf.result.Result;
import com.bit.werewolf.structure.round.ChangeReceipt;
import com.bit.werewolf.structure.round.RegistrationReceipt;
import com.bit.werewolf.structure.round.VoteRound;
import com.bit.werewolf.structure.vote.BallotRecord;
import com.bit.werewolf.structure.vote.VoteType;
import com.bit.werewolf.structure.vote.VoteWeight;

import java.util.Collection;
import java.util.List;

/**
 * 投票箱：持有当前这一轮的可投票者、可投对象和选票
 * 同一时刻只有一轮，开启新一轮会丢弃上一轮的选票
 */
public interface BallotBox {

    /**
     * 开启新一轮
     * @param voters 玩家ID或 PlayerInfo
     * @param targets 玩家ID或 PlayerInfo
     * @param relaxedTargets 为true时不要求投票对象在 targets 中
     */
    void startRound(Collection<?> voters, Collection<?> targets, VoteType voteType, int turn,
                    VotingPolicy policy, boolean relaxedTargets);

    default void startRound(Collection<?> voters, Collection<?> targets, VoteType voteType, int turn, VotingPolicy policy) {
        startRound(voters, targets, voteType, turn, policy, false);
    }

    default void startRound(Collection<?> voters, Collection<?> targets, VoteType voteType, int turn) {
        startRound(voters, targets, voteType, turn, VotingPolicy.defaults(), false);
    }

    /**
     * 登记投票，同一投票者再次登记时替换旧票
     * 校验失败以 Result 返回，不影响已登记的票
     */
    Result<RegistrationReceipt> register(int voterId, int targetId, VoteWeight weight);

    default Result<RegistrationReceipt> register(int voterId, int targetId) {
        return register(voterId, targetId, VoteWeight.ONE);
    }

    /**
     * 变更投票对象，对象不变时返回 unchanged 且不发布事件
     */
    Result<ChangeReceipt> changeVote(int voterId, int newTargetId);

    /**
     * 计票后本轮只读
     */
    void markTallied();

    boolean hasActiveRound();

    boolean hasVoted(int voterId);

    /**
     * @return 当前选票的快照，修改投票只能通过 register/changeVote
     */
    BallotRecord getVote(int voterId);

    boolean isValidTarget(int targetId);

    boolean isRoundComplete();

    List<Integer> remainingVoters();

    int totalVoters();

    int submittedCount();

    List<BallotRecord> currentBallots();

    List<Integer> getVoters();

    List<Integer> getTargets();

    VoteType getCurrentVoteType();

    VoteRound getCurrentRound();
}
