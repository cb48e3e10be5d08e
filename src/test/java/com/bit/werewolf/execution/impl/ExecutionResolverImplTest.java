package com.bit.werewolf.execution.impl;

import com.bit.werewolf.error.VoteErrorCode;
import com.bit.werewolf.error.VoteException;
import com.bit.werewolf.event.VoteEvent;
import com.bit.werewolf.execution.ExecutionResolver;
import com.bit.werewolf.player.impl.InMemoryPlayerRoster;
import com.bit.werewolf.policy.ExecutionRule;
import com.bit.werewolf.policy.VotingPolicy;
import com.bit.werewolf.runoff.TieBreaker;
import com.bit.werewolf.structure.decision.ExecutionDecision;
import com.bit.werewolf.structure.decision.ExecutionOutcome;
import com.bit.werewolf.structure.tally.TallyResult;
import com.bit.werewolf.structure.vote.Ballot;
import com.bit.werewolf.structure.vote.VoteType;
import com.bit.werewolf.tally.TallyEngine;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@SpringBootTest
@RecordApplicationEvents
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
public class ExecutionResolverImplTest {

    @Autowired
    private ExecutionResolver executionResolver;

    @Autowired
    private TallyEngine tallyEngine;

    @Autowired
    private TieBreaker tieBreaker;

    @Autowired
    private InMemoryPlayerRoster roster;

    @Autowired
    private ApplicationEvents applicationEvents;

    private TallyResult tied;

    @BeforeEach
    void setUp() {
        roster.addPlayer(1, "阿明", "villager");
        roster.addPlayer(2, "小红", "werewolf");
        roster.addPlayer(3, "老王", "seer");
        roster.addPlayer(4, "小李", "villager");
        // 4人投票，2号和3号各2票
        tied = tallyEngine.count(Arrays.asList(
                Ballot.create(1, 2, VoteType.EXECUTION, 2),
                Ballot.create(2, 3, VoteType.EXECUTION, 2),
                Ballot.create(3, 2, VoteType.EXECUTION, 2),
                Ballot.create(4, 3, VoteType.EXECUTION, 2)));
    }

    @Test
    void testRuleDispatchTable() {
        assertTrue(tied.isTie());

        ExecutionDecision random = executionResolver.decide(tied, ExecutionRule.RANDOM, tieBreaker);
        assertEquals(ExecutionDecision.Kind.EXECUTE, random.getKind());
        assertTrue(Arrays.asList(2, 3).contains(random.getTarget()), "随机结果必须是平票者之一");

        ExecutionDecision none = executionResolver.decide(tied, ExecutionRule.NO_EXECUTION, tieBreaker);
        assertNull(none.getExecutionTarget());

        ExecutionDecision all = executionResolver.decide(tied, ExecutionRule.ALL_EXECUTION, tieBreaker);
        assertEquals("all", all.getExecutionTarget());

        ExecutionDecision runoff = executionResolver.decide(tied, ExecutionRule.RUNOFF, tieBreaker);
        assertTrue(runoff.isNeedsRunoff());
        assertEquals(Arrays.asList(2, 3), runoff.getCandidates());

        ExecutionDecision unknown = executionResolver.decide(tied, ExecutionRule.UNRECOGNIZED, tieBreaker);
        assertTrue(unknown.isNeedsRunoff(), "无法识别的规则按决选处理");
        assertEquals(Arrays.asList(2, 3), executionResolver.getLastTiedCandidates());
    }

    @Test
    void testDecideWithoutTie() {
        TallyResult single = tallyEngine.count(Arrays.asList(
                Ballot.create(1, 4, VoteType.EXECUTION, 2),
                Ballot.create(2, 4, VoteType.EXECUTION, 2),
                Ballot.create(3, 1, VoteType.EXECUTION, 2)));
        for (ExecutionRule rule : ExecutionRule.values()) {
            assertEquals(ExecutionDecision.execute(4), executionResolver.decide(single, rule, tieBreaker));
        }
        assertEquals(ExecutionDecision.Kind.NO_EXECUTION,
                executionResolver.decide(TallyResult.EMPTY, ExecutionRule.RUNOFF, tieBreaker).getKind());
    }

    @Test
    void testExecuteSingleTarget() {
        ExecutionOutcome outcome = executionResolver.apply(ExecutionDecision.execute(2), 2, VotingPolicy.defaults());

        assertEquals(1, outcome.getCount());
        assertEquals("werewolf", outcome.getExecuted().get(0).getRole(), "公开角色");
        assertFalse(roster.isAlive(2));
        assertEquals(Arrays.asList("execution.before", "execution.after"), eventNames());

        VoteEvent after = applicationEvents.stream(VoteEvent.class)
                .filter(e -> "execution.after".equals(e.getName())).findFirst().orElseThrow();
        assertEquals(2, after.get("targetId"));
        assertEquals("小红", after.get("playerName"));
        assertEquals("werewolf", after.get("role"));
    }

    @Test
    void testExecuteWithoutRoleReveal() {
        VotingPolicy hidden = VotingPolicy.defaults().toBuilder().revealRoleOnDeath(false).build();
        ExecutionOutcome outcome = executionResolver.apply(ExecutionDecision.execute(3), 2, hidden);
        assertNull(outcome.getExecuted().get(0).getRole());
        assertFalse(roster.isAlive(3));
    }

    @Test
    void testExecuteInvalidTargets() {
        VoteException unknown = assertThrows(VoteException.class,
                () -> executionResolver.apply(ExecutionDecision.execute(99), 2, VotingPolicy.defaults()));
        assertEquals(VoteErrorCode.INVALID_TARGET, unknown.getErrorCode());

        roster.kill(4, "night");
        applicationEvents.clear();
        VoteException dead = assertThrows(VoteException.class,
                () -> executionResolver.apply(ExecutionDecision.execute(4), 2, VotingPolicy.defaults()));
        assertEquals(VoteErrorCode.ALREADY_DEAD, dead.getErrorCode());
        assertTrue(eventNames().isEmpty(), "检查失败时不发布处刑事件");
        assertEquals(3, roster.getAlivePlayers().size());
    }

    @Test
    void testNoExecution() {
        ExecutionOutcome outcome = executionResolver.apply(ExecutionDecision.noExecution(), 2, VotingPolicy.defaults());
        assertFalse(outcome.isExecuted());
        assertEquals(4, roster.getAlivePlayers().size());
        assertEquals(Arrays.asList("execution.none"), eventNames());
    }

    @Test
    void testExecuteAllSkipsDead() {
        // 2名存活候选人和1名已死亡候选人
        roster.kill(4, "night");
        ExecutionOutcome outcome = executionResolver.apply(ExecutionDecision.executeAll(Arrays.asList(2, 3, 4)), 2,
                VotingPolicy.defaults());

        assertEquals(2, outcome.getCount());
        assertFalse(roster.isAlive(2));
        assertFalse(roster.isAlive(3));
        assertTrue(roster.isAlive(1));
        assertEquals(Arrays.asList("execution.all.before", "execution.all.after"), eventNames());
    }

    @Test
    void testExecuteAllUsesLastTiedSet() {
        executionResolver.decide(tied, ExecutionRule.ALL_EXECUTION, tieBreaker);
        ExecutionOutcome outcome = executionResolver.apply(ExecutionDecision.executeAll(Arrays.asList()), 2,
                VotingPolicy.defaults());
        assertEquals(2, outcome.getCount());
    }

    @Test
    void testExecuteAllWithoutCandidates() {
        VoteException e = assertThrows(VoteException.class,
                () -> executionResolver.apply(ExecutionDecision.executeAll(Arrays.asList()), 2, VotingPolicy.defaults()));
        assertEquals(VoteErrorCode.NO_CANDIDATES, e.getErrorCode());
    }

    @Test
    void testRunoffDecisionCannotBeApplied() {
        assertThrows(IllegalStateException.class,
                () -> executionResolver.apply(ExecutionDecision.runoff(Arrays.asList(2, 3)), 2, VotingPolicy.defaults()));
    }

    private List<String> eventNames() {
        return applicationEvents.stream(VoteEvent.class).map(VoteEvent::getName).collect(Collectors.toList());
    }
}
