package com.bit.werewolf.service.impl;

import com.bit.werewolf.audit.AuditLog;
import com.bit.werewolf.ballot.BallotBox;
import com.bit.werewolf.config.VoteProperties;
import com.bit.werewolf.error.ErrorFactory;
import com.bit.werewolf.error.VoteErrorCode;
import com.bit.werewolf.error.VoteException;
import com.bit.werewolf.event.PhaseEvent;
import com.bit.werewolf.event.PlayerDeathEvent;
import com.bit.werewolf.event.VoteEventPublisher;
import com.bit.werewolf.event.VoteEventType;
import com.bit.werewolf.execution.ExecutionResolver;
import com.bit.werewolf.phase.PhaseSource;
import com.bit.werewolf.player.PlayerRoster;
import com.bit.werewolf.policy.VotingPolicy;
import com.bit.werewolf.result.Result;
import com.bit.werewolf.runoff.RunoffCoordinator;
import com.bit.werewolf.runoff.TieBreaker;
import com.bit.werewolf.service.VoteFacade;
import com.bit.werewolf.structure.decision.ExecutionDecision;
import com.bit.werewolf.structure.decision.ExecutionOutcome;
import com.bit.werewolf.structure.dto.VisibleVote;
import com.bit.werewolf.structure.dto.VoteStatus;
import com.bit.werewolf.structure.player.PlayerInfo;
import com.bit.werewolf.structure.round.ChangeReceipt;
import com.bit.werewolf.structure.round.RegistrationReceipt;
import com.bit.werewolf.structure.round.RoundStart;
import com.bit.werewolf.structure.round.RunoffStart;
import com.bit.werewolf.structure.round.VoteRound;
import com.bit.werewolf.structure.summary.TurnSummary;
import com.bit.werewolf.structure.tally.TallyResult;
import com.bit.werewolf.structure.tally.VoteCountResult;
import com.bit.werewolf.structure.vote.BallotRecord;
import com.bit.werewolf.structure.vote.VoteType;
import com.bit.werewolf.structure.vote.VoteWeight;
import com.bit.werewolf.tally.TallyEngine;
import com.bit.werewolf.util.PlayerIds;
import com.bit.werewolf.visibility.VoteVisibility;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class VoteFacadeImpl implements VoteFacade {

    @Autowired
    private VoteProperties properties;

    @Autowired
    private PlayerRoster roster;

    @Autowired
    private PhaseSource phaseSource;

    @Autowired
    private BallotBox ballotBox;

    @Autowired
    private TallyEngine tallyEngine;

    @Autowired
    private RunoffCoordinator runoffCoordinator;

    @Autowired
    private ExecutionResolver executionResolver;

    @Autowired
    private AuditLog auditLog;

    @Autowired
    private VoteVisibility visibility;

    @Autowired
    private TieBreaker tieBreaker;

    @Autowired
    private ErrorFactory errorFactory;

    @Autowired
    private VoteEventPublisher events;

    private volatile VotingPolicy policy = VotingPolicy.defaults();

    private ExecutionDecision pendingDecision;

    @PostConstruct
    public void init() {
        applyPolicy(properties.toPolicy());
        visibility.configure(properties.toVisibilitySettings());
    }

    //---------------------------------------------------------------- 阶段驱动

    @EventListener
    public synchronized void onPhase(PhaseEvent event) {
        if (!event.isVotePhase()) {
            return;
        }
        try {
            if (PhaseEvent.VOTE.equals(event.getPhase())) {
                if (event.getStage() == PhaseEvent.Stage.START) {
                    Result<RoundStart> started = startVoting(VoteType.EXECUTION);
                    if (started.isFailure()) {
                        log.warn("第{}天处刑投票未能开启: {}", event.getTurn(), started.getMessage());
                    }
                } else if (ballotBox.hasActiveRound()) {
                    VoteCountResult counted = countVotes();
                    settle(determineExecution(counted.getTally()));
                }
            } else {
                if (event.getStage() == PhaseEvent.Stage.START) {
                    if (pendingDecision == null || !pendingDecision.isNeedsRunoff()) {
                        log.warn("第{}天没有待决选的平票，忽略决选阶段", event.getTurn());
                        return;
                    }
                    Result<RunoffStart> started = startRunoff(pendingDecision.getCandidates());
                    if (started.isFailure()) {
                        log.warn("第{}天决选投票未能开启: {}", event.getTurn(), started.getMessage());
                    }
                } else if (ballotBox.getCurrentVoteType() == VoteType.RUNOFF) {
                    settle(finalizeRunoff());
                }
            }
        } catch (VoteException e) {
            log.warn("处理阶段{} {}失败: {}", event.getPhase(), event.getStage(), e.toString());
        }
    }

    /**
     * 保存决议，配置了自动执行且不需要决选时立即执行
     */
    private void settle(ExecutionDecision decision) {
        pendingDecision = decision;
        if (decision.isNeedsRunoff()) {
            log.info("平票，等待决选 候选人={}", decision.getCandidates());
            return;
        }
        if (policy.isAutoExecute()) {
            executeTarget(decision);
        }
    }

    /**
     * 投票中途死亡的玩家，其本轮选票写入历史，选票仍留在本轮参与计票
     */
    @EventListener
    public synchronized void onPlayerDeath(PlayerDeathEvent event) {
        BallotRecord ballot = ballotBox.getVote(event.getPlayerId());
        if (ballot != null) {
            auditLog.record(ballot);
            log.info("玩家{}死亡({})，记录其本轮选票 {}", event.getPlayerId(), event.getCause(), ballot);
        }
    }

    //---------------------------------------------------------------- 轮次

    @Override
    public Result<RoundStart> startVoting(VoteType type) {
        return startVoting(type, null, null);
    }

    @Override
    public synchronized Result<RoundStart> startVoting(VoteType type, Collection<?> customVoters, Collection<?> customTargets) {
        Preconditions.checkNotNull(type, "投票类型不能为空");
        int turn = phaseSource.getCurrentTurn();
        String phase = phaseSource.getCurrentPhase();

        if (type == VoteType.EXECUTION && turn == 1 && !policy.isFirstDayExecution()) {
            log.info("首日不进行处刑投票");
            return Result.ok(RoundStart.skipped(type, turn, RoundStart.FIRST_DAY_NO_EXECUTION));
        }
        if (type != VoteType.SPECIAL && !PhaseEvent.VOTE.equals(phase) && !PhaseEvent.RUNOFF_VOTE.equals(phase)) {
            return Result.error(errorFactory.createError(VoteErrorCode.INVALID_PHASE,
                    ImmutableMap.of("message", "当前阶段[" + phase + "]不能开启投票", "phase", String.valueOf(phase), "turn", turn)));
        }

        List<Integer> aliveIds = aliveIds();
        ImmutableList<Integer> voters = ImmutableList.copyOf(customVoters == null ? aliveIds : PlayerIds.extract(customVoters));
        ImmutableList<Integer> targets = ImmutableList.copyOf(customTargets == null ? aliveIds : PlayerIds.extract(customTargets));
        if (voters.isEmpty()) {
            return Result.error(errorFactory.createError(VoteErrorCode.NO_VOTERS, ImmutableMap.of("turn", turn)));
        }
        if (targets.isEmpty()) {
            return Result.error(errorFactory.createError(VoteErrorCode.NO_TARGETS, ImmutableMap.of("turn", turn)));
        }

        if (type == VoteType.EXECUTION) {
            runoffCoordinator.resetAttempts();
            pendingDecision = null;
        }
        ballotBox.startRound(voters, targets, type, turn, policy, customTargets != null);
        events.publish(VoteEventType.VOTE_START, turn, "type", type, "turn", turn, "voters", voters, "targets", targets);
        return Result.ok(RoundStart.started(type, turn, voters, targets));
    }

    @Override
    public synchronized Result<RegistrationReceipt> registerVote(int voterId, int targetId) {
        VoteWeight weight = roster.hasDoubleVote(voterId) ? VoteWeight.DOUBLE : VoteWeight.ONE;
        try {
            Result<RegistrationReceipt> result = ballotBox.register(voterId, targetId, weight);
            if (result.isSuccess()) {
                auditLog.record(result.getData().getBallot());
            }
            return result;
        } catch (VoteException e) {
            log.warn("登记投票失败 {}->{}: {}", voterId, targetId, e.getMessage());
            return Result.error(e);
        }
    }

    @Override
    public synchronized Result<ChangeReceipt> changeVote(int voterId, int newTargetId) {
        try {
            Result<ChangeReceipt> result = ballotBox.changeVote(voterId, newTargetId);
            if (result.isSuccess() && !result.getData().isUnchanged()) {
                auditLog.record(result.getData().getBallot());
            }
            return result;
        } catch (VoteException e) {
            log.warn("变更投票失败 {}->{}: {}", voterId, newTargetId, e.getMessage());
            return Result.error(e);
        }
    }

    @Override
    public synchronized VoteCountResult countVotes() {
        VoteRound round = ballotBox.getCurrentRound();
        if (round == null) {
            throw errorFactory.createError(VoteErrorCode.NO_ACTIVE_ROUND,
                    ImmutableMap.of("message", "没有进行中的投票，无法计票"));
        }
        int turn = round.getTurn();
        VoteType type = round.getVoteType();
        ImmutableList<BallotRecord> ballots = round.currentBallots();

        events.publish(VoteEventType.VOTE_COUNT_BEFORE, turn, "type", type, "turn", turn, "ballots", ballots);
        TallyResult tally = tallyEngine.count(ballots);
        boolean needsRunoff = type == VoteType.RUNOFF
                ? runoffCoordinator.needsAnotherRunoff(tally.isTie(), policy.getRunoffTieRule())
                : runoffCoordinator.needsRunoff(tally.isTie(), policy.getExecutionRule());
        ballotBox.markTallied();
        if (type == VoteType.RUNOFF) {
            runoffCoordinator.markTallied();
        }
        events.publish(VoteEventType.VOTE_COUNT_AFTER, turn,
                "type", type,
                "turn", turn,
                "ballots", ballots,
                "counts", tally.getCounts(),
                "maxVoted", tally.getMaxVoted(),
                "isTie", tally.isTie(),
                "needsRunoff", needsRunoff);
        log.info("第{}天{}计票 {}张 得票={} 平票={}", turn, type.getValue(), ballots.size(), tally.getCounts(), tally.isTie());
        return new VoteCountResult(type, turn, ballots, tally, needsRunoff);
    }

    @Override
    public synchronized ExecutionDecision determineExecution(TallyResult tally) {
        ExecutionDecision decision = executionResolver.decide(tally, policy.getExecutionRule(), tieBreaker);
        if (decision.isNeedsRunoff() && !runoffCoordinator.needsRunoff(true, policy.getExecutionRule())) {
            //决选次数用尽
            decision = runoffCoordinator.resolveTie(decision.getCandidates(), policy.getRunoffTieRule());
        }
        log.info("处刑决议 {}", decision);
        return decision;
    }

    @Override
    public synchronized Result<RunoffStart> startRunoff(List<Integer> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Result.error(VoteErrorCode.NO_CANDIDATES);
        }
        try {
            return Result.ok(runoffCoordinator.startRunoff(candidates, ballotBox, currentTurn(), policy));
        } catch (VoteException e) {
            log.warn("开启决选失败: {}", e.getMessage());
            return Result.error(e);
        }
    }

    @Override
    public synchronized ExecutionDecision finalizeRunoff() {
        VoteRound round = ballotBox.getCurrentRound();
        if (round == null || round.getVoteType() != VoteType.RUNOFF) {
            throw errorFactory.createError(VoteErrorCode.NO_ACTIVE_ROUND,
                    ImmutableMap.of("message", "没有进行中的决选投票"));
        }
        VoteCountResult counted = countVotes();
        ExecutionDecision decision = runoffCoordinator.finalizeRunoff(counted.getTally(), policy.getRunoffTieRule(), counted.getTurn());
        pendingDecision = decision;
        return decision;
    }

    @Override
    public synchronized Result<ExecutionOutcome> executeTarget(ExecutionDecision decision) {
        Preconditions.checkNotNull(decision, "处刑决议不能为空");
        if (decision.isNeedsRunoff()) {
            return Result.error(VoteErrorCode.INVALID_PHASE, "需要先进行决选投票");
        }
        try {
            ExecutionOutcome outcome = executionResolver.apply(decision, currentTurn(), policy);
            if (decision.equals(pendingDecision)) {
                pendingDecision = null;
            }
            return Result.ok(outcome);
        } catch (VoteException e) {
            log.warn("处刑失败 {}: {}", decision, e.getMessage());
            return Result.error(e);
        }
    }

    @Override
    public synchronized ExecutionDecision getPendingDecision() {
        return pendingDecision;
    }

    //---------------------------------------------------------------- 查询

    @Override
    public List<BallotRecord> getVoteHistory(Integer turn, VoteType type) {
        return auditLog.query(turn, type);
    }

    @Override
    public List<BallotRecord> getPlayerVoteHistory(int playerId) {
        return auditLog.queryByVoter(playerId);
    }

    @Override
    public TurnSummary getVoteSummary(int turn) {
        return auditLog.summarize(turn);
    }

    @Override
    public List<VisibleVote> getVisibleVotes(Integer viewerId) {
        return visibility.getVisibleVotes(ballotBox.currentBallots(), viewerId, ballotBox.isRoundComplete());
    }

    @Override
    public Map<Integer, Integer> getVisibleCounts(Integer viewerId) {
        return visibility.getVisibleCounts(tallyEngine.count(ballotBox.currentBallots()).getCounts(), viewerId);
    }

    @Override
    public synchronized VoteStatus getVoteStatus(Integer viewerId) {
        VoteStatus status = VoteStatus.builder()
                .active(ballotBox.hasActiveRound())
                .type(ballotBox.getCurrentVoteType())
                .turn(currentTurn())
                .totalVoters(ballotBox.totalVoters())
                .submitted(ballotBox.submittedCount())
                .complete(ballotBox.isRoundComplete())
                .remainingVoters(ballotBox.remainingVoters())
                .build();
        return visibility.getVisibleStatus(status, ballotBox.currentBallots(), viewerId);
    }

    @Override
    public List<Integer> getVotersOf(int targetId) {
        return tallyEngine.votersOf(ballotBox.currentBallots(), targetId);
    }

    @Override
    public boolean isVotingComplete() {
        return ballotBox.isRoundComplete();
    }

    @Override
    public BallotRecord getVote(int voterId) {
        return ballotBox.getVote(voterId);
    }

    @Override
    public List<BallotRecord> getCurrentVotes() {
        return ballotBox.currentBallots();
    }

    @Override
    public void resetRunoffAttempts() {
        runoffCoordinator.resetAttempts();
    }

    @Override
    public void setMaxRunoffAttempts(int maxAttempts) {
        runoffCoordinator.setMaxAttempts(maxAttempts);
    }

    @Override
    public VotingPolicy getPolicy() {
        return policy;
    }

    @Override
    public synchronized void applyPolicy(VotingPolicy policy) {
        Preconditions.checkNotNull(policy, "投票规则不能为空");
        this.policy = policy;
        runoffCoordinator.setMaxAttempts(policy.getMaxRunoffAttempts());
        log.info("应用投票规则 {}", policy);
    }

    private List<Integer> aliveIds() {
        ImmutableList.Builder<Integer> ids = ImmutableList.builder();
        for (PlayerInfo player : roster.getAlivePlayers()) {
            ids.add(player.getId());
        }
        return ids.build();
    }

    private int currentTurn() {
        VoteRound round = ballotBox.getCurrentRound();
        return round != null ? round.getTurn() : phaseSource.getCurrentTurn();
    }
}
