package com.bit.werewolf.policy;

import lombok.Builder;
import lombok.Value;

/**
 * 投票规则（不可变）
 * 每轮投票开启时显式传入，结果只取决于（选票, 规则）
 */
@Value
@Builder(toBuilder = true)
public class VotingPolicy {

    /** 首轮投票平票时的处理规则 */
    @Builder.Default
    ExecutionRule executionRule = ExecutionRule.RUNOFF;

    /** 决选投票仍平票时的处理规则 */
    @Builder.Default
    ExecutionRule runoffTieRule = ExecutionRule.RANDOM;

    @Builder.Default
    boolean allowSelfVote = false;

    /** 处刑后公开角色 */
    @Builder.Default
    boolean revealRoleOnDeath = true;

    /** 第一天是否进行处刑投票 */
    @Builder.Default
    boolean firstDayExecution = true;

    /** 连续决选投票的上限，保证反复平票时流程能结束 */
    @Builder.Default
    int maxRunoffAttempts = 3;

    /** 决议确定后立即执行处刑 */
    @Builder.Default
    boolean autoExecute = true;

    public static VotingPolicy defaults() {
        return VotingPolicy.builder().build();
    }
}
