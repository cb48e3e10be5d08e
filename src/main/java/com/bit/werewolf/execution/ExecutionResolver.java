package com.bit.werewolf.execution;

import com.bit.werewolf.policy.ExecutionRule;
import com.bit.werewolf.policy.VotingPolicy;
import com.bit.werewolf.runoff.TieBreaker;
import com.bit.werewolf.structure.decision.ExecutionDecision;
import com.bit.werewolf.structure.decision.ExecutionOutcome;
import com.bit.werewolf.structure.tally.TallyResult;

import java.util.List;

/**
 * 处刑决议与执行
 * apply 是投票子系统唯一修改玩家名册的地方
 */
public interface ExecutionResolver {

    /**
     * 按计票结果和首轮平票规则给出决议，无法识别的规则按决选处理
     */
    ExecutionDecision decide(TallyResult tally, ExecutionRule executionRule, TieBreaker tieBreaker);

    /**
     * 执行决议
     * 单人处刑在修改名册前完成全部检查；全部处刑逐个执行，跳过已死亡的候选人
     * @throws com.bit.werewolf.error.VoteException INVALID_TARGET / ALREADY_DEAD / NO_CANDIDATES
     */
    ExecutionOutcome apply(ExecutionDecision decision, int turn, VotingPolicy policy);

    /**
     * 最近一次平票的候选人
     */
    List<Integer> getLastTiedCandidates();
}
