package com.bit.werewolf.structure.vote;

import com.bit.werewolf.error.VoteErrorCode;
import com.bit.werewolf.error.VoteException;
import com.bit.werewolf.util.PlayerIds;
import com.bit.werewolf.util.VoteClock;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 一张选票
 * 投票者、类型、权重、轮次在创建时固定，只有投票对象可以通过 changeTarget 修改
 */
@Slf4j
@Getter
public class Ballot implements WeightedVote {

    private final int voterId;

    private int targetId;

    private final VoteType voteType;

    private final VoteWeight weight;

    private final int turn;

    /**
     * 创建时间，变更对象时刷新
     */
    private long timestamp;

    private Ballot(int voterId, int targetId, VoteType voteType, VoteWeight weight, int turn, long timestamp) {
        this.voterId = voterId;
        this.targetId = targetId;
        this.voteType = voteType;
        this.weight = weight;
        this.turn = turn;
        this.timestamp = timestamp;
    }

    public static Ballot create(int voterId, int targetId, VoteType voteType, VoteWeight weight, int turn, long timestamp) {
        if (!PlayerIds.isValid(voterId)) {
            throw VoteException.of(VoteErrorCode.INVALID_BALLOT, "不正确的投票者ID: " + voterId);
        }
        if (!PlayerIds.isValid(targetId)) {
            throw VoteException.of(VoteErrorCode.INVALID_BALLOT, "不正确的投票对象ID: " + targetId);
        }
        if (voteType == null) {
            throw VoteException.of(VoteErrorCode.INVALID_BALLOT, "未指定投票类型");
        }
        if (weight == null) {
            throw VoteException.of(VoteErrorCode.INVALID_BALLOT, "未指定投票权重");
        }
        if (turn < 1) {
            throw VoteException.of(VoteErrorCode.INVALID_BALLOT, "不正确的轮次: " + turn);
        }
        Ballot ballot = new Ballot(voterId, targetId, voteType, weight, turn, timestamp);
        log.debug("创建选票 voter={} target={} type={} weight={}", voterId, targetId, voteType, weight);
        return ballot;
    }

    public static Ballot create(int voterId, int targetId, VoteType voteType, int weight, int turn) {
        return create(voterId, targetId, voteType, VoteWeight.of(weight), turn, VoteClock.next());
    }

    public static Ballot create(int voterId, int targetId, VoteType voteType, int turn) {
        return create(voterId, targetId, voteType, VoteWeight.ONE, turn, VoteClock.next());
    }

    /**
     * 变更投票对象并刷新时间戳
     * 与当前对象相同的判断由调用方负责
     */
    public void changeTarget(int newTargetId) {
        if (!PlayerIds.isValid(newTargetId)) {
            throw VoteException.of(VoteErrorCode.INVALID_BALLOT, "不正确的投票对象ID: " + newTargetId);
        }
        this.targetId = newTargetId;
        this.timestamp = VoteClock.next();
    }

    /**
     * 当前状态的快照
     */
    public BallotRecord toRecord() {
        return BallotRecord.builder()
                .voterId(voterId)
                .targetId(targetId)
                .voteType(voteType)
                .weight(weight)
                .turn(turn)
                .timestamp(timestamp)
                .build();
    }

    @Override
    public String toString() {
        return "Ballot{" + voterId + "->" + targetId + ", " + voteType.getValue() + ", " + weight
                + ", turn=" + turn + ", ts=" + timestamp + "}";
    }
}
