package com.bit.werewolf.structure.round;

import com.bit.werewolf.structure.vote.VoteType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.google.common.collect.ImmutableList;
import lombok.Value;

/**
 * 开启投票的结果
 * 首日不处刑时 skipped=true 并给出原因，不开启任何轮次
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoundStart {

    public static final String FIRST_DAY_NO_EXECUTION = "first_day_no_execution";

    VoteType type;
    int turn;
    ImmutableList<Integer> voters;
    ImmutableList<Integer> targets;
    boolean skipped;
    String reason;

    public static RoundStart started(VoteType type, int turn, ImmutableList<Integer> voters, ImmutableList<Integer> targets) {
        return new RoundStart(type, turn, voters, targets, false, null);
    }

    public static RoundStart skipped(VoteType type, int turn, String reason) {
        return new RoundStart(type, turn, ImmutableList.of(), ImmutableList.of(), true, reason);
    }
}
