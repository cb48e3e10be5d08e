package com.bit.werewolf.error;

import com.bit.werewolf.result.Result;

/**
 * 错误分类
 */
public enum VoteErrorCategory {
    /** 校验错误：可恢复，返回给调用方，不中断本轮投票 */
    VALIDATION(Result.SC_VALIDATION_400),
    /** 前置条件错误：阶段不对、无投票者、处刑对象已死亡等 */
    PRECONDITION(Result.SC_PRECONDITION_409),
    /** 一致性错误：未开启投票就操作、已计票后继续修改 */
    CONSISTENCY(Result.SC_PRECONDITION_409),

    ;

    private final int status;

    VoteErrorCategory(int status) {
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
