package com.bit.werewolf.role;

import lombok.Value;

/**
 * 角色投票限制的检查结果
 */
@Value
public class ConstraintResult {

    private static final ConstraintResult ALLOWED = new ConstraintResult(true, null, null);

    boolean allowed;
    //拒绝原因，如 CANNOT_VOTE_LOVER
    String reason;
    String message;

    public static ConstraintResult allow() {
        return ALLOWED;
    }

    public static ConstraintResult deny(String reason, String message) {
        return new ConstraintResult(false, reason, message);
    }
}
