package com.bit.werewolf.structure.round;

import com.google.common.collect.ImmutableList;
import lombok.Value;

/**
 * 决选投票开启结果
 */
@Value
public class RunoffStart {
    int attempt;
    ImmutableList<Integer> voters;
    ImmutableList<Integer> candidates;

    public int getVoterCount() {
        return voters.size();
    }

    public int getCandidateCount() {
        return candidates.size();
    }
}
