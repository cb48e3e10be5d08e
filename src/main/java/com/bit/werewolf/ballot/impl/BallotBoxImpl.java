package com.bit.werewolf.ballot.impl;

import com.bit.werewolf.ballot.BallotBox;
import com.bit.werewolf.error.VoteErrorCode;
import com.bit.werewolf.event.VoteEventPublisher;
import com.bit.werewolf.event.VoteEventType;
import com.bit.werewolf.player.PlayerRoster;
import com.bit.werewolf.policy.VotingPolicy;
import com.bit.werewolf.result.Result;
import com.bit.werewolf.role.ConstraintResult;
import com.bit.werewolf.role.VoteConstraintChecker;
import com.bit.werewolf.structure.player.PlayerInfo;
import com.bit.werewolf.structure.round.ChangeReceipt;
import com.bit.werewolf.structure.round.RegistrationReceipt;
import com.bit.werewolf.structure.round.VoteRound;
import com.bit.werewolf.structure.vote.Ballot;
import com.bit.werewolf.structure.vote.BallotRecord;
import com.bit.werewolf.structure.vote.VoteType;
import com.bit.werewolf.structure.vote.VoteWeight;
import com.bit.werewolf.util.PlayerIds;
import com.bit.werewolf.util.VoteClock;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Slf4j
@Component
public class BallotBoxImpl implements BallotBox {

    @Autowired
    private PlayerRoster roster;

    @Autowired
    private VoteEventPublisher events;

    @Autowired(required = false)
    private List<VoteConstraintChecker> constraintCheckers = new ArrayList<>();

    private VoteRound round;

    @Override
    public synchronized void startRound(Collection<?> voters, Collection<?> targets, VoteType voteType, int turn,
                                        VotingPolicy policy, boolean relaxedTargets) {
        List<Integer> voterIds = PlayerIds.extract(voters);
        List<Integer> targetIds = PlayerIds.extract(targets);
        if (round != null && round.submittedCount() > 0 && !round.isTallied()) {
            log.warn("第{}天{}投票未计票即被新一轮替换，丢弃{}张票", round.getTurn(), round.getVoteType().getValue(), round.submittedCount());
        }
        round = new VoteRound(voteType, turn, voterIds, targetIds, relaxedTargets,
                policy == null ? VotingPolicy.defaults() : policy);
        log.info("开启第{}天{}投票 投票者={} 对象={}{}", turn, voteType.getValue(), voterIds, targetIds,
                relaxedTargets ? " (自定义对象)" : "");
    }

    @Override
    public synchronized Result<RegistrationReceipt> register(int voterId, int targetId, VoteWeight weight) {
        Result<RegistrationReceipt> invalid = validate(voterId, targetId);
        if (invalid != null) {
            log.warn("拒绝投票 {}->{} 原因={}", voterId, targetId, invalid.getReason());
            return invalid;
        }
        BallotRecord previous = round.getBallot(voterId);
        Integer previousTarget = previous == null ? null : previous.getTargetId();
        Ballot ballot = Ballot.create(voterId, targetId, round.getVoteType(),
                weight == null ? VoteWeight.ONE : weight, round.getTurn(), VoteClock.next());
        BallotRecord record = ballot.toRecord();
        boolean change = previous != null;

        events.publish(VoteEventType.VOTE_REGISTER_BEFORE, round.getTurn(),
                "ballot", record, "isChange", change, "previousTarget", previousTarget);
        round.putBallot(ballot);
        events.publish(VoteEventType.VOTE_REGISTER_AFTER, round.getTurn(),
                "ballot", record, "isChange", change, "previousTarget", previousTarget);

        log.debug("登记投票 {} ({}/{})", ballot, round.submittedCount(), round.getVoters().size());
        return Result.ok(new RegistrationReceipt(record, change, previousTarget));
    }

    @Override
    public synchronized Result<ChangeReceipt> changeVote(int voterId, int newTargetId) {
        if (round == null) {
            return Result.error(VoteErrorCode.NO_ACTIVE_ROUND);
        }
        BallotRecord current = round.getBallot(voterId);
        if (current == null) {
            return Result.error(VoteErrorCode.NO_PREVIOUS_VOTE, "玩家" + voterId + "本轮尚未投票");
        }
        Result<ChangeReceipt> invalid = validate(voterId, newTargetId);
        if (invalid != null) {
            log.warn("拒绝变更投票 {}->{} 原因={}", voterId, newTargetId, invalid.getReason());
            return invalid;
        }
        int oldTargetId = current.getTargetId();
        if (oldTargetId == newTargetId) {
            return Result.ok(new ChangeReceipt(current, oldTargetId, newTargetId, true));
        }

        events.publish(VoteEventType.VOTE_CHANGE_BEFORE, round.getTurn(),
                "voterId", voterId, "oldTargetId", oldTargetId, "newTargetId", newTargetId);
        BallotRecord record = round.changeTarget(voterId, newTargetId);
        events.publish(VoteEventType.VOTE_CHANGE_AFTER, round.getTurn(),
                "voterId", voterId, "oldTargetId", oldTargetId, "newTargetId", newTargetId, "ballot", record);

        log.debug("变更投票 玩家{} {}->{}", voterId, oldTargetId, newTargetId);
        return Result.ok(new ChangeReceipt(record, oldTargetId, newTargetId, false));
    }

    /**
     * 登记和变更共用的校验，按顺序返回第一个失败，全部通过返回null
     */
    private <T> Result<T> validate(int voterId, int targetId) {
        if (round == null) {
            return Result.error(VoteErrorCode.NO_ACTIVE_ROUND);
        }
        if (round.isTallied()) {
            return Result.error(VoteErrorCode.ROUND_CLOSED);
        }
        PlayerInfo voter = roster.getPlayer(voterId);
        if (voter == null) {
            return Result.error(VoteErrorCode.INVALID_VOTER, "玩家" + voterId + "不存在");
        }
        if (!voter.isAlive()) {
            return Result.error(VoteErrorCode.DEAD_VOTER, "玩家" + voterId + "已死亡，不能投票");
        }
        if (!round.getVoters().contains(voterId)) {
            return Result.error(VoteErrorCode.INVALID_VOTER, "玩家" + voterId + "不是本轮的投票者");
        }
        if (roster.getPlayer(targetId) == null) {
            return Result.error(VoteErrorCode.INVALID_TARGET, "投票对象" + targetId + "不存在");
        }
        if (!round.isRelaxedTargets() && !round.getTargets().contains(targetId)) {
            return Result.error(VoteErrorCode.INELIGIBLE_TARGET, "玩家" + targetId + "不是本轮的投票对象");
        }
        if (voterId == targetId && !round.getPolicy().isAllowSelfVote()) {
            return Result.error(VoteErrorCode.SELF_VOTE_FORBIDDEN);
        }
        for (VoteConstraintChecker checker : constraintCheckers) {
            ConstraintResult constraint = checker.check(voterId, targetId);
            if (constraint != null && !constraint.isAllowed()) {
                String reason = constraint.getReason() != null ? constraint.getReason() : VoteErrorCode.ROLE_CONSTRAINT_VIOLATION.name();
                String message = constraint.getMessage() != null ? constraint.getMessage() : VoteErrorCode.ROLE_CONSTRAINT_VIOLATION.getDefaultMessage();
                return Result.reject(reason, VoteErrorCode.ROLE_CONSTRAINT_VIOLATION.getCategory().getStatus(), message);
            }
        }
        return null;
    }

    @Override
    public synchronized void markTallied() {
        if (round != null) {
            round.markTallied();
        }
    }

    @Override
    public synchronized boolean hasActiveRound() {
        return round != null;
    }

    @Override
    public synchronized boolean hasVoted(int voterId) {
        return round != null && round.getBallot(voterId) != null;
    }

    @Override
    public synchronized BallotRecord getVote(int voterId) {
        return round == null ? null : round.getBallot(voterId);
    }

    @Override
    public synchronized boolean isValidTarget(int targetId) {
        if (round == null) {
            return false;
        }
        return round.isRelaxedTargets() ? roster.getPlayer(targetId) != null : round.getTargets().contains(targetId);
    }

    @Override
    public synchronized boolean isRoundComplete() {
        return round != null && remainingVoters().isEmpty();
    }

    @Override
    public synchronized List<Integer> remainingVoters() {
        if (round == null) {
            return ImmutableList.of();
        }
        ImmutableList.Builder<Integer> remaining = ImmutableList.builder();
        for (Integer voter : round.getVoters()) {
            if (round.getBallot(voter) == null) {
                remaining.add(voter);
            }
        }
        return remaining.build();
    }

    @Override
    public synchronized int totalVoters() {
        return round == null ? 0 : round.getVoters().size();
    }

    @Override
    public synchronized int submittedCount() {
        return round == null ? 0 : round.submittedCount();
    }

    @Override
    public synchronized List<BallotRecord> currentBallots() {
        return round == null ? ImmutableList.of() : round.currentBallots();
    }

    @Override
    public synchronized List<Integer> getVoters() {
        return round == null ? ImmutableList.of() : round.getVoters().asList();
    }

    @Override
    public synchronized List<Integer> getTargets() {
        return round == null ? ImmutableList.of() : round.getTargets().asList();
    }

    @Override
    public synchronized VoteType getCurrentVoteType() {
        return round == null ? null : round.getVoteType();
    }

    @Override
    public synchronized VoteRound getCurrentRound() {
        return round;
    }
}
