package com.bit.werewolf.tally;

import com.bit.werewolf.structure.summary.TypeSummary;
import com.bit.werewolf.structure.tally.TallyResult;
import com.bit.werewolf.structure.tally.TieCheck;
import com.bit.werewolf.structure.vote.VoteType;
import com.bit.werewolf.structure.vote.WeightedVote;

import java.util.Collection;
import java.util.List;

/**
 * 计票，纯函数，不持有状态
 */
public interface TallyEngine {

    /**
     * 按权重累计每个对象的得票
     * 无票时返回空结果，不抛异常
     */
    TallyResult count(Collection<? extends WeightedVote> ballots);

    TieCheck checkForTie(TallyResult tally);

    /**
     * 单个对象的得票（展示用）
     */
    int countFor(Collection<? extends WeightedVote> ballots, int targetId);

    /**
     * 投给某个对象的投票者，按投票顺序
     */
    List<Integer> votersOf(Collection<? extends WeightedVote> ballots, int targetId);

    TypeSummary summarize(Collection<? extends WeightedVote> ballots, VoteType type, int turn);
}
