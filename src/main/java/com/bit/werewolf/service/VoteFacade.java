package com.bit.werewolf.service;

import com.bit.werewolf.policy.VotingPolicy;
import com.bit.werewolf.result.Result;
import com.bit.werewolf.structure.decision.ExecutionDecision;
import com.bit.werewolf.structure.decision.ExecutionOutcome;
import com.bit.werewolf.structure.dto.VisibleVote;
import com.bit.werewolf.structure.dto.VoteStatus;
import com.bit.werewolf.structure.round.ChangeReceipt;
import com.bit.werewolf.structure.round.RegistrationReceipt;
import com.bit.werewolf.structure.round.RoundStart;
import com.bit.werewolf.structure.round.RunoffStart;
import com.bit.werewolf.structure.summary.TurnSummary;
import com.bit.werewolf.structure.tally.TallyResult;
import com.bit.werewolf.structure.tally.VoteCountResult;
import com.bit.werewolf.structure.vote.BallotRecord;
import com.bit.werewolf.structure.vote.VoteType;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 投票子系统的统一入口
 * 可失败的操作返回 Result；countVotes 在没有投票轮次时抛出 VoteException（调用顺序错误）
 */
public interface VoteFacade {

    /**
     * 开启投票，投票者和对象为全部存活玩家
     */
    Result<RoundStart> startVoting(VoteType type);

    /**
     * 开启投票
     * @param customVoters 为null时取全部存活玩家
     * @param customTargets 为null时取全部存活玩家，否则本轮不限制对象范围
     */
    Result<RoundStart> startVoting(VoteType type, Collection<?> customVoters, Collection<?> customTargets);

    Result<RegistrationReceipt> registerVote(int voterId, int targetId);

    Result<ChangeReceipt> changeVote(int voterId, int newTargetId);

    VoteCountResult countVotes();

    /**
     * 首轮投票的决议，决选次数用尽时按决选平票规则决胜
     */
    ExecutionDecision determineExecution(TallyResult tally);

    Result<RunoffStart> startRunoff(List<Integer> candidates);

    /**
     * 对当前决选计票并给出决议
     */
    ExecutionDecision finalizeRunoff();

    Result<ExecutionOutcome> executeTarget(ExecutionDecision decision);

    /**
     * 已确定但尚未执行的决议，需要决选时为 RUNOFF 决议
     */
    ExecutionDecision getPendingDecision();

    List<BallotRecord> getVoteHistory(Integer turn, VoteType type);

    List<BallotRecord> getPlayerVoteHistory(int playerId);

    TurnSummary getVoteSummary(int turn);

    List<VisibleVote> getVisibleVotes(Integer viewerId);

    Map<Integer, Integer> getVisibleCounts(Integer viewerId);

    VoteStatus getVoteStatus(Integer viewerId);

    List<Integer> getVotersOf(int targetId);

    boolean isVotingComplete();

    BallotRecord getVote(int voterId);

    List<BallotRecord> getCurrentVotes();

    void resetRunoffAttempts();

    void setMaxRunoffAttempts(int maxAttempts);

    VotingPolicy getPolicy();

    void applyPolicy(VotingPolicy policy);
}
