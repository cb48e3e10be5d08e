package com.bit.werewolf.structure.round;

import com.bit.werewolf.structure.vote.BallotRecord;
import lombok.Value;

/**
 * 登记投票的结果
 */
@Value
public class RegistrationReceipt {
    BallotRecord ballot;
    //同一轮已投过票时为true，旧票被替换
    boolean change;
    Integer previousTarget;
}
