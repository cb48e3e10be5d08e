package com.bit.werewolf.structure.tally;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Value;

/**
 * 计票结果
 * counts 和 maxVoted 都按对象第一次出现的顺序，平票时不做任何取舍
 */
@Value
public class TallyResult {

    public static final TallyResult EMPTY = new TallyResult(ImmutableMap.of(), 0, ImmutableList.of());

    ImmutableMap<Integer, Integer> counts;
    int maxCount;
    ImmutableList<Integer> maxVoted;

    @JsonProperty("isTie")
    public boolean isTie() {
        return maxVoted.size() > 1;
    }

    public int getCount(int targetId) {
        return counts.getOrDefault(targetId, 0);
    }

    /**
     * 唯一最高票对象，平票或无票时为null
     */
    public Integer getLeader() {
        return maxVoted.size() == 1 ? maxVoted.get(0) : null;
    }
}
