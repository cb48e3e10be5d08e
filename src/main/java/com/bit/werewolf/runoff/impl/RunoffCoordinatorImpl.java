package com.bit.werewolf.runoff.impl;

import com.bit.werewolf.ballot.BallotBox;
import com.bit.werewolf.error.ErrorFactory;
import com.bit.werewolf.error.VoteErrorCode;
import com.bit.werewolf.event.VoteEventPublisher;
import com.bit.werewolf.event.VoteEventType;
import com.bit.werewolf.player.PlayerRoster;
import com.bit.werewolf.policy.ExecutionRule;
import com.bit.werewolf.policy.VotingPolicy;
import com.bit.werewolf.runoff.RunoffCoordinator;
import com.bit.werewolf.runoff.RunoffState;
import com.bit.werewolf.runoff.TieBreaker;
import com.bit.werewolf.structure.decision.ExecutionDecision;
import com.bit.werewolf.structure.player.PlayerInfo;
import com.bit.werewolf.structure.round.RunoffStart;
import com.bit.werewolf.structure.tally.TallyResult;
import com.bit.werewolf.structure.vote.VoteType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class RunoffCoordinatorImpl implements RunoffCoordinator {

    @Autowired
    private PlayerRoster roster;

    @Autowired
    private TieBreaker tieBreaker;

    @Autowired
    private ErrorFactory errorFactory;

    @Autowired
    private VoteEventPublisher events;

    private int attempts = 0;

    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    private RunoffState state = RunoffState.IDLE;

    @Override
    public synchronized RunoffStart startRunoff(List<Integer> candidates, BallotBox ballotBox, int turn, VotingPolicy policy) {
        ImmutableList.Builder<Integer> voters = ImmutableList.builder();
        for (PlayerInfo player : roster.getAlivePlayers()) {
            voters.add(player.getId());
        }
        ImmutableList.Builder<Integer> alive = ImmutableList.builder();
        for (Integer candidate : candidates) {
            if (roster.isAlive(candidate)) {
                alive.add(candidate);
            }
        }
        ImmutableList<Integer> voterIds = voters.build();
        ImmutableList<Integer> candidateIds = alive.build();
        if (candidateIds.isEmpty()) {
            throw errorFactory.createError(VoteErrorCode.NO_CANDIDATES,
                    ImmutableMap.of("message", "决选候选人均已死亡", "candidates", candidates, "turn", turn));
        }
        if (voterIds.isEmpty()) {
            throw errorFactory.createError(VoteErrorCode.NO_VOTERS,
                    ImmutableMap.of("message", "没有存活的投票者", "turn", turn));
        }

        attempts++;
        ballotBox.startRound(voterIds, candidateIds, VoteType.RUNOFF, turn, policy);
        state = RunoffState.RUNOFF_OPEN;
        log.info("第{}天第{}次决选投票 候选人={} 投票者{}人", turn, attempts, candidateIds, voterIds.size());

        events.publish(VoteEventType.RUNOFF_START, turn,
                "turn", turn, "voters", voterIds, "candidates", candidateIds, "attempt", attempts);
        return new RunoffStart(attempts, voterIds, candidateIds);
    }

    @Override
    public synchronized void markTallied() {
        if (state == RunoffState.RUNOFF_OPEN) {
            state = RunoffState.RUNOFF_TALLIED;
        }
    }

    @Override
    public synchronized ExecutionDecision finalizeRunoff(TallyResult tally, ExecutionRule runoffTieRule, int turn) {
        ExecutionDecision decision;
        if (!tally.isTie()) {
            decision = tally.getMaxVoted().isEmpty()
                    ? ExecutionDecision.noExecution()
                    : ExecutionDecision.execute(tally.getMaxVoted().get(0));
        } else if (needsAnotherRunoff(true, runoffTieRule)) {
            decision = ExecutionDecision.runoff(tally.getMaxVoted());
        } else {
            decision = resolveTie(tally.getMaxVoted(), runoffTieRule);
        }
        state = decision.isNeedsRunoff() ? RunoffState.RUNOFF_TALLIED : RunoffState.RESOLVED;
        log.info("第{}天决选结果 得票={} 决议={}", turn, tally.getCounts(), decision);

        events.publish(VoteEventType.RUNOFF_RESULT, turn,
                "turn", turn,
                "counts", tally.getCounts(),
                "maxCount", tally.getMaxCount(),
                "maxVoted", tally.getMaxVoted(),
                "isTie", tally.isTie(),
                "needsRunoff", decision.isNeedsRunoff(),
                "executionTarget", decision.getExecutionTarget());
        return decision;
    }

    @Override
    public ExecutionDecision resolveTie(List<Integer> tiedPlayers, ExecutionRule rule) {
        ExecutionRule effective = rule == null ? ExecutionRule.RANDOM : rule;
        switch (effective) {
            case NO_EXECUTION:
                return ExecutionDecision.noExecution();
            case ALL_EXECUTION:
                return ExecutionDecision.executeAll(tiedPlayers);
            case RANDOM:
                break;
            default:
                log.warn("决胜规则[{}]不能用于平票决胜，按随机处理", effective.getValue());
                break;
        }
        Integer picked = tieBreaker.pick(tiedPlayers);
        return picked == null ? ExecutionDecision.noExecution() : ExecutionDecision.execute(picked);
    }

    @Override
    public synchronized boolean needsRunoff(boolean isTie, ExecutionRule rule) {
        if (!isTie) {
            return false;
        }
        if (attempts >= maxAttempts) {
            log.info("决选已进行{}次，达到上限{}", attempts, maxAttempts);
            return false;
        }
        return rule == ExecutionRule.RUNOFF || rule == ExecutionRule.UNRECOGNIZED;
    }

    @Override
    public synchronized boolean needsAnotherRunoff(boolean isTie, ExecutionRule runoffTieRule) {
        return runoffTieRule == ExecutionRule.RUNOFF && needsRunoff(isTie, runoffTieRule);
    }

    @Override
    public synchronized void resetAttempts() {
        attempts = 0;
        state = RunoffState.IDLE;
    }

    @Override
    public synchronized void setMaxAttempts(int maxAttempts) {
        if (maxAttempts <= 0) {
            log.warn("忽略无效的决选次数上限{}", maxAttempts);
            return;
        }
        this.maxAttempts = maxAttempts;
    }

    @Override
    public synchronized int getAttempts() {
        return attempts;
    }

    @Override
    public synchronized int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public synchronized RunoffState getState() {
        return state;
    }
}
