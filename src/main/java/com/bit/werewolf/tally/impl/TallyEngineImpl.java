package com.bit.werewolf.tally.impl;

import com.bit.werewolf.structure.summary.TypeSummary;
import com.bit.werewolf.structure.tally.TallyResult;
import com.bit.werewolf.structure.tally.TieCheck;
import com.bit.werewolf.structure.vote.BallotRecord;
import com.bit.werewolf.structure.vote.VoteType;
import com.bit.werewolf.structure.vote.WeightedVote;
import com.bit.werewolf.tally.TallyEngine;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class TallyEngineImpl implements TallyEngine {

    @Override
    public TallyResult count(Collection<? extends WeightedVote> ballots) {
        if (ballots == null || ballots.isEmpty()) {
            return TallyResult.EMPTY;
        }
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (WeightedVote ballot : ballots) {
            counts.merge(ballot.getTargetId(), ballot.getWeight().getValue(), Integer::sum);
        }

        int maxCount = 0;
        for (int count : counts.values()) {
            maxCount = Math.max(maxCount, count);
        }
        ImmutableList.Builder<Integer> maxVoted = ImmutableList.builder();
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() == maxCount) {
                maxVoted.add(entry.getKey());
            }
        }
        TallyResult result = new TallyResult(ImmutableMap.copyOf(counts), maxCount, maxVoted.build());
        log.debug("计票 {}张 得票={} 最高={} 平票={}", ballots.size(), result.getCounts(), result.getMaxVoted(), result.isTie());
        return result;
    }

    @Override
    public TieCheck checkForTie(TallyResult tally) {
        if (tally == null || !tally.isTie()) {
            return new TieCheck(false, ImmutableList.of());
        }
        return new TieCheck(true, tally.getMaxVoted());
    }

    @Override
    public int countFor(Collection<? extends WeightedVote> ballots, int targetId) {
        int total = 0;
        for (WeightedVote ballot : ballots) {
            if (ballot.getTargetId() == targetId) {
                total += ballot.getWeight().getValue();
            }
        }
        return total;
    }

    @Override
    public List<Integer> votersOf(Collection<? extends WeightedVote> ballots, int targetId) {
        ImmutableList.Builder<Integer> voters = ImmutableList.builder();
        for (WeightedVote ballot : ballots) {
            if (ballot.getTargetId() == targetId) {
                voters.add(ballot.getVoterId());
            }
        }
        return voters.build();
    }

    @Override
    public TypeSummary summarize(Collection<? extends WeightedVote> ballots, VoteType type, int turn) {
        TallyResult tally = count(ballots);
        ImmutableList.Builder<BallotRecord> votes = ImmutableList.builder();
        if (ballots != null) {
            for (WeightedVote ballot : ballots) {
                votes.add(BallotRecord.of(ballot));
            }
        }
        return TypeSummary.builder()
                .type(type)
                .turn(turn)
                .votes(votes.build())
                .counts(tally.getCounts())
                .maxCount(tally.getMaxCount())
                .maxVoted(tally.getMaxVoted())
                .build();
    }
}
