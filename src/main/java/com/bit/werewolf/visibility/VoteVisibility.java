package com.bit.werewolf.visibility;

import com.bit.werewolf.structure.dto.VisibleVote;
import com.bit.werewolf.structure.dto.VoteStatus;
import com.bit.werewolf.structure.vote.WeightedVote;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按观察者过滤投票信息
 * viewerId 为null表示主持人视角，可以看到全部
 */
@Slf4j
@Component
public class VoteVisibility {

    private volatile VisibilitySettings settings = VisibilitySettings.defaults();

    public void configure(VisibilitySettings settings) {
        log.debug("投票公开设置 {}", settings);
        this.settings = settings;
    }

    public VisibilitySettings getSettings() {
        return settings;
    }

    public List<VisibleVote> getVisibleVotes(List<? extends WeightedVote> ballots, Integer viewerId, boolean complete) {
        VisibilitySettings current = settings;
        if (viewerId == null || current.isShowRealTimeVotes()) {
            ImmutableList.Builder<VisibleVote> builder = ImmutableList.builder();
            boolean anonymous = (current.isAnonymousUntilEnd() && !complete) || (viewerId != null && !current.isShowVoterNames());
            for (WeightedVote ballot : ballots) {
                VisibleVote vote = VisibleVote.of(ballot);
                builder.add(anonymous ? vote.anonymous() : vote);
            }
            return builder.build();
        }
        //只能看到自己的票
        WeightedVote own = findOwn(ballots, viewerId);
        return own == null ? ImmutableList.of() : ImmutableList.of(VisibleVote.of(own));
    }

    public Map<Integer, Integer> getVisibleCounts(Map<Integer, Integer> counts, Integer viewerId) {
        if (viewerId != null && !settings.isShowVoteCount()) {
            return ImmutableMap.of();
        }
        return ImmutableMap.copyOf(counts);
    }

    public VoteStatus getVisibleStatus(VoteStatus status, List<? extends WeightedVote> ballots, Integer viewerId) {
        VoteStatus.VoteStatusBuilder builder = status.toBuilder().votes(null).ownVote(null).counts(null);
        if (viewerId == null) {
            return builder.votes(getVisibleVotes(ballots, null, true)).build();
        }
        WeightedVote own = findOwn(ballots, viewerId);
        if (own != null) {
            builder.ownVote(VisibleVote.of(own));
        }
        VisibilitySettings current = settings;
        if (current.isShowRealTimeVotes()) {
            if (current.isAnonymousUntilEnd() && !status.isComplete()) {
                //匿名期间只公开得票数
                Map<Integer, Integer> counts = new LinkedHashMap<>();
                for (WeightedVote ballot : ballots) {
                    counts.merge(ballot.getTargetId(), ballot.getWeight().getValue(), Integer::sum);
                }
                builder.counts(getVisibleCounts(counts, viewerId));
            } else {
                builder.votes(getVisibleVotes(ballots, viewerId, status.isComplete()));
            }
        }
        return builder.build();
    }

    private WeightedVote findOwn(List<? extends WeightedVote> ballots, int viewerId) {
        for (WeightedVote ballot : ballots) {
            if (ballot.getVoterId() == viewerId) {
                return ballot;
            }
        }
        return null;
    }
}
