package com.bit.werewolf.runoff;

import com.bit.werewolf.ballot.BallotBox;
import com.bit.werewolf.policy.ExecutionRule;
import com.bit.werewolf.policy.VotingPolicy;
import com.bit.werewolf.structure.decision.ExecutionDecision;
import com.bit.werewolf.structure.round.RunoffStart;
import com.bit.werewolf.structure.tally.TallyResult;

import java.util.List;

/**
 * 决选投票协调
 * 状态 IDLE -> RUNOFF_OPEN -> RUNOFF_TALLIED -> RESOLVED，
 * 连续决选次数有上限，保证反复平票时流程能结束
 */
public interface RunoffCoordinator {

    int DEFAULT_MAX_ATTEMPTS = 3;

    /**
     * 以仍存活的候选人开启决选，投票者为全部存活玩家
     */
    RunoffStart startRunoff(List<Integer> candidates, BallotBox ballotBox, int turn, VotingPolicy policy);

    void markTallied();

    /**
     * 决选结束：无平票处刑最高票者，平票时仍可决选则再次决选，否则按规则决胜
     */
    ExecutionDecision finalizeRunoff(TallyResult tally, ExecutionRule runoffTieRule, int turn);

    /**
     * 平票决胜
     * RANDOM 随机一人；NO_EXECUTION 不处刑；ALL_EXECUTION 全部处刑；其他值按 RANDOM
     */
    ExecutionDecision resolveTie(List<Integer> tiedPlayers, ExecutionRule rule);

    /**
     * 首轮投票平票时是否进入决选，未识别的规则按决选处理
     */
    boolean needsRunoff(boolean isTie, ExecutionRule rule);

    /**
     * 决选再次平票时是否继续决选，只有 RUNOFF 会继续，其他值交给 resolveTie
     */
    boolean needsAnotherRunoff(boolean isTie, ExecutionRule runoffTieRule);

    void resetAttempts();

    /**
     * n <= 0 时忽略
     */
    void setMaxAttempts(int maxAttempts);

    int getAttempts();

    int getMaxAttempts();

    RunoffState getState();
}
