package com.bit.werewolf.structure.summary;

import com.bit.werewolf.structure.vote.VoteType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import lombok.Value;

/**
 * 一天投票的最终结果，决选优先于首轮
 */
@Value
public class SummaryResult {

    public static final SummaryResult NONE = new SummaryResult(null, null, false, ImmutableMap.of());

    //结果取自哪一类投票
    VoteType source;
    //平票时为null
    Integer executionTarget;
    @JsonProperty("isTie")
    boolean tie;
    ImmutableMap<Integer, Integer> counts;
}
