package com.bit.werewolf.audit;

import com.bit.werewolf.structure.summary.TurnSummary;
import com.bit.werewolf.structure.vote.BallotRecord;
import com.bit.werewolf.structure.vote.VoteType;
import com.bit.werewolf.structure.vote.WeightedVote;

import java.util.List;

/**
 * 投票历史，只追加不修改
 * 变更投票会追加一条新记录，保留投票者在一天内的完整选择过程
 */
public interface AuditLog {

    void record(WeightedVote vote);

    List<BallotRecord> getAll();

    List<BallotRecord> queryByTurn(int turn);

    List<BallotRecord> queryByTurn(int turn, VoteType type);

    List<BallotRecord> queryByVoter(int voterId);

    List<BallotRecord> queryByTarget(int targetId);

    /**
     * 按条件过滤，条件为null时不过滤
     */
    List<BallotRecord> query(Integer turn, VoteType type);

    /**
     * 某一天各类投票的汇总，每个投票者只取最后一票
     */
    TurnSummary summarize(int turn);

    int size();

    void clear();
}
