package com.bit.werewolf.audit.impl;

import com.bit.werewolf.audit.AuditLog;
import com.bit.werewolf.structure.summary.SummaryResult;
import com.bit.werewolf.structure.summary.TurnSummary;
import com.bit.werewolf.structure.summary.TypeSummary;
import com.bit.werewolf.structure.vote.BallotRecord;
import com.bit.werewolf.structure.vote.VoteType;
import com.bit.werewolf.structure.vote.WeightedVote;
import com.bit.werewolf.tally.TallyEngine;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class AuditLogImpl implements AuditLog {

    private final TallyEngine tallyEngine;

    //按记录顺序
    private final List<BallotRecord> history = new ArrayList<>();

    private final ListMultimap<TurnKey, BallotRecord> byTurnAndType = ArrayListMultimap.create();

    private final ListMultimap<Integer, BallotRecord> byVoter = ArrayListMultimap.create();

    private final ListMultimap<Integer, BallotRecord> byTarget = ArrayListMultimap.create();

    @Autowired
    public AuditLogImpl(TallyEngine tallyEngine) {
        this.tallyEngine = tallyEngine;
    }

    @Override
    public synchronized void record(WeightedVote vote) {
        BallotRecord record = BallotRecord.of(vote);
        history.add(record);
        byTurnAndType.put(new TurnKey(record.getTurn(), record.getVoteType()), record);
        byVoter.put(record.getVoterId(), record);
        byTarget.put(record.getTargetId(), record);
        log.debug("记录投票历史 #{} {}->{} 第{}天{}", history.size(), record.getVoterId(), record.getTargetId(),
                record.getTurn(), record.getVoteType().getValue());
    }

    @Override
    public synchronized List<BallotRecord> getAll() {
        return ImmutableList.copyOf(history);
    }

    @Override
    public synchronized List<BallotRecord> queryByTurn(int turn) {
        return query(turn, null);
    }

    @Override
    public synchronized List<BallotRecord> queryByTurn(int turn, VoteType type) {
        if (type == null) {
            return query(turn, null);
        }
        return ImmutableList.copyOf(byTurnAndType.get(new TurnKey(turn, type)));
    }

    @Override
    public synchronized List<BallotRecord> queryByVoter(int voterId) {
        return ImmutableList.copyOf(byVoter.get(voterId));
    }

    @Override
    public synchronized List<BallotRecord> queryByTarget(int targetId) {
        return ImmutableList.copyOf(byTarget.get(targetId));
    }

    @Override
    public synchronized List<BallotRecord> query(Integer turn, VoteType type) {
        ImmutableList.Builder<BallotRecord> result = ImmutableList.builder();
        for (BallotRecord record : history) {
            if (turn != null && record.getTurn() != turn) {
                continue;
            }
            if (type != null && record.getVoteType() != type) {
                continue;
            }
            result.add(record);
        }
        return result.build();
    }

    @Override
    public synchronized TurnSummary summarize(int turn) {
        Map<VoteType, TypeSummary> types = new EnumMap<>(VoteType.class);
        for (VoteType type : VoteType.values()) {
            List<BallotRecord> records = byTurnAndType.get(new TurnKey(turn, type));
            if (records.isEmpty()) {
                continue;
            }
            types.put(type, tallyEngine.summarize(latestPerVoter(records), type, turn));
        }

        //决选结果优先
        TypeSummary decisive = types.containsKey(VoteType.RUNOFF) ? types.get(VoteType.RUNOFF) : types.get(VoteType.EXECUTION);
        SummaryResult results = SummaryResult.NONE;
        if (decisive != null) {
            Integer target = decisive.isTie() || decisive.getMaxVoted().isEmpty() ? null : decisive.getMaxVoted().get(0);
            results = new SummaryResult(decisive.getType(), target, decisive.isTie(), decisive.getCounts());
        }
        return new TurnSummary(turn, ImmutableMap.copyOf(types), results);
    }

    /**
     * 每个投票者只保留时间戳最新的一票，时间戳相同时后记录的为准
     */
    private List<BallotRecord> latestPerVoter(List<BallotRecord> records) {
        Map<Integer, BallotRecord> latest = new LinkedHashMap<>();
        for (BallotRecord record : records) {
            BallotRecord current = latest.get(record.getVoterId());
            if (current == null || record.getTimestamp() >= current.getTimestamp()) {
                latest.put(record.getVoterId(), record);
            }
        }
        return new ArrayList<>(latest.values());
    }

    @Override
    public synchronized int size() {
        return history.size();
    }

    @Override
    public synchronized void clear() {
        history.clear();
        byTurnAndType.clear();
        byVoter.clear();
        byTarget.clear();
        log.info("清空投票历史");
    }

    private static final class TurnKey {
        private final int turn;
        private final VoteType type;

        private TurnKey(int turn, VoteType type) {
            this.turn = turn;
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof TurnKey)) {
                return false;
            }
            TurnKey other = (TurnKey) o;
            return turn == other.turn && type == other.type;
        }

        @Override
        public int hashCode() {
            return 31 * turn + type.hashCode();
        }
    }
}
