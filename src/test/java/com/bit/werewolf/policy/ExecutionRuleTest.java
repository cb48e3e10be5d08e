package com.bit.werewolf.policy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExecutionRuleTest {

    @Test
    void testFromValue() {
        assertEquals(ExecutionRule.RUNOFF, ExecutionRule.fromValue("runoff"));
        assertEquals(ExecutionRule.NO_EXECUTION, ExecutionRule.fromValue("no-execution"));
        assertEquals(ExecutionRule.ALL_EXECUTION, ExecutionRule.fromValue(" ALL_EXECUTION "));
        assertEquals(ExecutionRule.RANDOM, ExecutionRule.fromValue("Random"));
        // 无法识别的配置不抛异常
        assertEquals(ExecutionRule.UNRECOGNIZED, ExecutionRule.fromValue("coin_flip"));
        assertEquals(ExecutionRule.UNRECOGNIZED, ExecutionRule.fromValue(null));
        assertEquals(ExecutionRule.UNRECOGNIZED, ExecutionRule.fromValue("unrecognized"));
    }

    @Test
    void testPolicyDefaults() {
        VotingPolicy policy = VotingPolicy.defaults();
        assertEquals(ExecutionRule.RUNOFF, policy.getExecutionRule());
        assertEquals(ExecutionRule.RANDOM, policy.getRunoffTieRule());
        assertFalse(policy.isAllowSelfVote());
        assertTrue(policy.isRevealRoleOnDeath());
        assertTrue(policy.isFirstDayExecution());
        assertEquals(3, policy.getMaxRunoffAttempts());

        VotingPolicy changed = policy.toBuilder().allowSelfVote(true).build();
        assertTrue(changed.isAllowSelfVote());
        assertFalse(policy.isAllowSelfVote(), "原规则不可变");
    }
}
