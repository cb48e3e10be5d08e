package com.bit.werewolf.structure.tally;

import com.google.common.collect.ImmutableList;
import lombok.Value;

@Value
public class TieCheck {
    boolean tie;
    ImmutableList<Integer> tiedPlayers;
}
