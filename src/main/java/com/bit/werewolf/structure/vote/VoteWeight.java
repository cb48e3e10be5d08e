package com.bit.werewolf.structure.vote;

import com.bit.werewolf.error.VoteErrorCode;
import com.bit.werewolf.error.VoteException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

/**
 * 票的权重，登记时根据投票者身份算出一次，之后不再变化
 */
@EqualsAndHashCode
public final class VoteWeight {

    public static final VoteWeight ONE = new VoteWeight(1);
    public static final VoteWeight DOUBLE = new VoteWeight(2);

    private final int value;

    private VoteWeight(int value) {
        this.value = value;
    }

    @JsonCreator
    public static VoteWeight of(int value) {
        if (value <= 0) {
            throw VoteException.of(VoteErrorCode.INVALID_BALLOT, "不正确的投票权重: " + value);
        }
        if (value == 1) {
            return ONE;
        }
        if (value == 2) {
            return DOUBLE;
        }
        return new VoteWeight(value);
    }

    @JsonValue
    public int getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "x" + value;
    }
}
