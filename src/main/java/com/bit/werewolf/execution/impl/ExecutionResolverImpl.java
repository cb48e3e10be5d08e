package com.bit.werewolf.execution.impl;

import com.bit.werewolf.error.ErrorFactory;
import com.bit.werewolf.error.VoteErrorCode;
import com.bit.werewolf.event.VoteEventPublisher;
import com.bit.werewolf.event.VoteEventType;
import com.bit.werewolf.execution.ExecutionResolver;
import com.bit.werewolf.player.PlayerRoster;
import com.bit.werewolf.policy.ExecutionRule;
import com.bit.werewolf.policy.VotingPolicy;
import com.bit.werewolf.runoff.TieBreaker;
import com.bit.werewolf.structure.decision.ExecutedPlayer;
import com.bit.werewolf.structure.decision.ExecutionDecision;
import com.bit.werewolf.structure.decision.ExecutionOutcome;
import com.bit.werewolf.structure.player.PlayerInfo;
import com.bit.werewolf.structure.tally.TallyResult;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class ExecutionResolverImpl implements ExecutionResolver {

    public static final String CAUSE_EXECUTION = "execution";

    @Autowired
    private PlayerRoster roster;

    @Autowired
    private ErrorFactory errorFactory;

    @Autowired
    private VoteEventPublisher events;

    private volatile ImmutableList<Integer> lastTiedCandidates = ImmutableList.of();

    @Override
    public ExecutionDecision decide(TallyResult tally, ExecutionRule executionRule, TieBreaker tieBreaker) {
        if (tally.getMaxVoted().isEmpty()) {
            //无人投票
            return ExecutionDecision.noExecution();
        }
        if (!tally.isTie()) {
            return ExecutionDecision.execute(tally.getMaxVoted().get(0));
        }
        lastTiedCandidates = tally.getMaxVoted();
        ExecutionRule rule = executionRule == null ? ExecutionRule.UNRECOGNIZED : executionRule;
        switch (rule) {
            case RANDOM:
                Integer picked = tieBreaker.pick(tally.getMaxVoted());
                return picked == null ? ExecutionDecision.noExecution() : ExecutionDecision.execute(picked);
            case NO_EXECUTION:
                return ExecutionDecision.noExecution();
            case ALL_EXECUTION:
                return ExecutionDecision.executeAll(tally.getMaxVoted());
            case RUNOFF:
                return ExecutionDecision.runoff(tally.getMaxVoted());
            default:
                log.warn("无法识别的平票规则，按决选投票处理 平票者={}", tally.getMaxVoted());
                return ExecutionDecision.runoff(tally.getMaxVoted());
        }
    }

    @Override
    public ExecutionOutcome apply(ExecutionDecision decision, int turn, VotingPolicy policy) {
        switch (decision.getKind()) {
            case NO_EXECUTION:
                log.info("第{}天不处刑", turn);
                events.publish(VoteEventType.EXECUTION_NONE, turn, "turn", turn, "reason", ExecutionOutcome.REASON_NO_EXECUTION);
                return ExecutionOutcome.none(turn, ExecutionOutcome.REASON_NO_EXECUTION);
            case EXECUTE_ALL:
                return executeAll(decision.getCandidates(), turn, policy);
            case EXECUTE:
                return executeOne(decision.getTarget(), turn, policy);
            default:
                throw new IllegalStateException("决选尚未结束，不能执行处刑: " + decision);
        }
    }

    private ExecutionOutcome executeOne(int targetId, int turn, VotingPolicy policy) {
        PlayerInfo target = roster.getPlayer(targetId);
        if (target == null) {
            throw errorFactory.createError(VoteErrorCode.INVALID_TARGET,
                    ImmutableMap.of("message", "处刑对象" + targetId + "不存在", "targetId", targetId, "turn", turn));
        }
        if (!target.isAlive()) {
            throw errorFactory.createError(VoteErrorCode.ALREADY_DEAD,
                    ImmutableMap.of("message", "玩家" + targetId + "已经死亡", "targetId", targetId, "turn", turn));
        }
        String role = policy.isRevealRoleOnDeath() ? target.getRoleName() : null;

        events.publish(VoteEventType.EXECUTION_BEFORE, turn,
                "targetId", targetId, "playerName", target.getName(), "turn", turn);
        roster.kill(targetId, CAUSE_EXECUTION);
        events.publish(VoteEventType.EXECUTION_AFTER, turn,
                "targetId", targetId, "playerName", target.getName(), "turn", turn, "role", role);

        log.info("第{}天处刑玩家{}({}){}", turn, targetId, target.getName(), role == null ? "" : " 角色=" + role);
        return new ExecutionOutcome(ExecutionDecision.Kind.EXECUTE, turn,
                ImmutableList.of(new ExecutedPlayer(targetId, target.getName(), role)), null);
    }

    private ExecutionOutcome executeAll(List<Integer> candidates, int turn, VotingPolicy policy) {
        List<Integer> source = candidates == null || candidates.isEmpty() ? lastTiedCandidates : candidates;
        if (source.isEmpty()) {
            throw errorFactory.createError(VoteErrorCode.NO_CANDIDATES,
                    ImmutableMap.of("message", "没有可处刑的候选人", "turn", turn));
        }
        List<PlayerInfo> targets = new ArrayList<>();
        for (Integer id : source) {
            PlayerInfo player = roster.getPlayer(id);
            if (player == null || !player.isAlive()) {
                log.info("候选人{}已不在场，跳过", id);
                continue;
            }
            targets.add(player);
        }
        List<Integer> targetIds = new ArrayList<>();
        for (PlayerInfo player : targets) {
            targetIds.add(player.getId());
        }

        events.publish(VoteEventType.EXECUTION_ALL_BEFORE, turn, "targetIds", targetIds, "turn", turn);
        ImmutableList.Builder<ExecutedPlayer> executed = ImmutableList.builder();
        for (PlayerInfo player : targets) {
            String role = policy.isRevealRoleOnDeath() ? player.getRoleName() : null;
            roster.kill(player.getId(), CAUSE_EXECUTION);
            executed.add(new ExecutedPlayer(player.getId(), player.getName(), role));
        }
        ImmutableList<ExecutedPlayer> result = executed.build();
        events.publish(VoteEventType.EXECUTION_ALL_AFTER, turn, "targets", result, "turn", turn, "count", result.size());

        log.info("第{}天平票者全部处刑 {}人 {}", turn, result.size(), targetIds);
        return new ExecutionOutcome(ExecutionDecision.Kind.EXECUTE_ALL, turn, result, null);
    }

    @Override
    public List<Integer> getLastTiedCandidates() {
        return lastTiedCandidates;
    }
}
