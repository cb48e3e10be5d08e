package com.bit.werewolf.structure.tally;

import com.bit.werewolf.structure.vote.BallotRecord;
import com.bit.werewolf.structure.vote.VoteType;
import com.google.common.collect.ImmutableList;
import lombok.Value;

/**
 * 一轮投票的计票结果，附带是否需要决选
 */
@Value
public class VoteCountResult {
    VoteType type;
    int turn;
    ImmutableList<BallotRecord> ballots;
    TallyResult tally;
    boolean needsRunoff;
}
