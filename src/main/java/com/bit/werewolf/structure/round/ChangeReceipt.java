package com.bit.werewolf.structure.round;

import com.bit.werewolf.structure.vote.BallotRecord;
import lombok.Value;

@Value
public class ChangeReceipt {
    BallotRecord ballot;
    int oldTargetId;
    int newTargetId;
    //新旧对象相同，未做任何修改
    boolean unchanged;
}
