package com.bit.werewolf.service.impl;

import com.bit.werewolf.error.VoteErrorCode;
import com.bit.werewolf.error.VoteException;
import com.bit.werewolf.event.PhaseEvent;
import com.bit.werewolf.event.VoteEvent;
import com.bit.werewolf.phase.impl.PhaseTracker;
import com.bit.werewolf.player.impl.InMemoryPlayerRoster;
import com.bit.werewolf.policy.ExecutionRule;
import com.bit.werewolf.policy.VotingPolicy;
import com.bit.werewolf.result.Result;
import com.bit.werewolf.service.VoteFacade;
import com.bit.werewolf.structure.decision.ExecutionDecision;
import com.bit.werewolf.structure.decision.ExecutionOutcome;
import com.bit.werewolf.structure.dto.VoteStatus;
import com.bit.werewolf.structure.round.ChangeReceipt;
import com.bit.werewolf.structure.round.RegistrationReceipt;
import com.bit.werewolf.structure.round.RoundStart;
import com.bit.werewolf.structure.round.RunoffStart;
import com.bit.werewolf.structure.summary.TurnSummary;
import com.bit.werewolf.structure.tally.VoteCountResult;
import com.bit.werewolf.structure.vote.BallotRecord;
import com.bit.werewolf.structure.vote.VoteType;
import com.bit.werewolf.structure.vote.VoteWeight;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@SpringBootTest
@RecordApplicationEvents
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
public class VoteFacadeImplTest {

    @Autowired
    private VoteFacade voteFacade;

    @Autowired
    private InMemoryPlayerRoster roster;

    @Autowired
    private PhaseTracker phaseTracker;

    @Autowired
    private ApplicationEventPublisher publisher;

    @Autowired
    private ApplicationEvents applicationEvents;

    @BeforeEach
    void setUp() {
        roster.addPlayer(1, "阿明", "villager");
        roster.addPlayer(2, "小红", "werewolf");
        roster.addPlayer(3, "老王", "seer");
        roster.addPlayer(4, "小李", "villager");
        roster.addPlayer(5, "小张", "knight");
    }

    @Test
    void testWeightedExample() {
        voteFacade.applyPolicy(VotingPolicy.defaults().toBuilder().allowSelfVote(true).build());
        roster.setDoubleVote(3, true);
        phaseTracker.enter(PhaseEvent.VOTE, 2);

        assertTrue(voteFacade.startVoting(VoteType.EXECUTION).isSuccess());
        assertTrue(voteFacade.registerVote(1, 3).isSuccess());
        assertTrue(voteFacade.registerVote(2, 3).isSuccess());
        Result<RegistrationReceipt> doubled = voteFacade.registerVote(3, 3);
        assertTrue(doubled.isSuccess());
        assertEquals(VoteWeight.DOUBLE, doubled.getData().getBallot().getWeight());

        VoteCountResult counted = voteFacade.countVotes();
        assertEquals(Collections.singletonMap(3, 4), counted.getTally().getCounts());
        assertEquals(Collections.singletonList(3), counted.getTally().getMaxVoted());
        assertFalse(counted.getTally().isTie());
        assertFalse(counted.isNeedsRunoff());
    }

    @Test
    void testPhaseDrivenExecution() {
        publisher.publishEvent(PhaseEvent.start(PhaseEvent.VOTE, 2));
        assertEquals(VoteType.EXECUTION, voteFacade.getVoteStatus(null).getType());

        voteFacade.registerVote(1, 3);
        voteFacade.registerVote(2, 3);
        voteFacade.registerVote(3, 4);
        voteFacade.registerVote(4, 3);
        voteFacade.registerVote(5, 1);
        assertTrue(voteFacade.isVotingComplete());

        publisher.publishEvent(PhaseEvent.end(PhaseEvent.VOTE, 2));

        assertFalse(roster.isAlive(3), "最高票者被处刑");
        assertNull(voteFacade.getPendingDecision(), "自动执行后没有待执行的决议");
        List<String> names = eventNames();
        assertEquals(Arrays.asList("vote.start",
                "vote.register.before", "vote.register.after",
                "vote.register.before", "vote.register.after",
                "vote.register.before", "vote.register.after",
                "vote.register.before", "vote.register.after",
                "vote.register.before", "vote.register.after",
                "vote.count.before", "vote.count.after",
                "execution.before", "execution.after"), names);
        VoteEvent after = findLast("execution.after");
        assertEquals("seer", after.get("role"));
    }

    @Test
    void testPhaseDrivenRunoff() {
        publisher.publishEvent(PhaseEvent.start(PhaseEvent.VOTE, 2));
        voteFacade.registerVote(1, 3);
        voteFacade.registerVote(2, 4);
        voteFacade.registerVote(3, 4);
        voteFacade.registerVote(4, 3);
        publisher.publishEvent(PhaseEvent.end(PhaseEvent.VOTE, 2));

        ExecutionDecision pending = voteFacade.getPendingDecision();
        assertNotNull(pending);
        assertTrue(pending.isNeedsRunoff());
        assertEquals(Arrays.asList(3, 4), pending.getCandidates());
        assertEquals(5, roster.getAlivePlayers().size(), "平票时不处刑");

        publisher.publishEvent(PhaseEvent.start(PhaseEvent.RUNOFF_VOTE, 2));
        assertEquals(VoteType.RUNOFF, voteFacade.getVoteStatus(null).getType());
        assertReason(voteFacade.registerVote(1, 2), VoteErrorCode.INELIGIBLE_TARGET);
        voteFacade.registerVote(1, 4);
        voteFacade.registerVote(2, 4);
        voteFacade.registerVote(5, 3);
        publisher.publishEvent(PhaseEvent.end(PhaseEvent.RUNOFF_VOTE, 2));

        assertFalse(roster.isAlive(4));
        assertTrue(roster.isAlive(3));
        VoteEvent result = findLast("vote.runoff.result");
        assertEquals(4, result.get("executionTarget"));

        TurnSummary summary = voteFacade.getVoteSummary(2);
        assertEquals(VoteType.RUNOFF, summary.getResults().getSource());
        assertEquals(4, summary.getResults().getExecutionTarget());
        assertTrue(summary.get(VoteType.EXECUTION).isTie());
    }

    @Test
    void testRepeatedTiesTerminate() {
        voteFacade.applyPolicy(VotingPolicy.defaults().toBuilder()
                .runoffTieRule(ExecutionRule.RUNOFF)
                .maxRunoffAttempts(2)
                .autoExecute(false)
                .build());
        phaseTracker.enter(PhaseEvent.VOTE, 2);
        voteFacade.startVoting(VoteType.EXECUTION);
        voteFacade.registerVote(1, 3);
        voteFacade.registerVote(2, 4);
        ExecutionDecision decision = voteFacade.determineExecution(voteFacade.countVotes().getTally());

        int runoffs = 0;
        while (decision.isNeedsRunoff()) {
            Result<RunoffStart> started = voteFacade.startRunoff(decision.getCandidates());
            assertTrue(started.isSuccess(), started.getMessage());
            runoffs++;
            assertTrue(runoffs <= 2, "决选次数超过上限");
            voteFacade.registerVote(1, 3);
            voteFacade.registerVote(2, 4);
            decision = voteFacade.finalizeRunoff();
        }
        assertEquals(2, runoffs);
        assertEquals(ExecutionDecision.Kind.EXECUTE, decision.getKind(), "次数用尽后随机决胜");
        assertTrue(Arrays.asList(3, 4).contains(decision.getTarget()));
        assertEquals(5, roster.getAlivePlayers().size(), "未开启自动执行");

        Result<ExecutionOutcome> executed = voteFacade.executeTarget(decision);
        assertTrue(executed.isSuccess());
        assertEquals(4, roster.getAlivePlayers().size());
    }

    @Test
    void testFirstDaySkip() {
        voteFacade.applyPolicy(VotingPolicy.defaults().toBuilder().firstDayExecution(false).build());
        phaseTracker.enter(PhaseEvent.VOTE, 1);

        Result<RoundStart> skipped = voteFacade.startVoting(VoteType.EXECUTION);
        assertTrue(skipped.isSuccess());
        assertTrue(skipped.getData().isSkipped());
        assertEquals(RoundStart.FIRST_DAY_NO_EXECUTION, skipped.getData().getReason());
        assertFalse(voteFacade.getVoteStatus(null).isActive());

        phaseTracker.enter(PhaseEvent.VOTE, 2);
        assertFalse(voteFacade.startVoting(VoteType.EXECUTION).getData().isSkipped());
    }

    @Test
    void testStartVotingPreconditions() {
        phaseTracker.enter("night", 2);
        assertReason(voteFacade.startVoting(VoteType.EXECUTION), VoteErrorCode.INVALID_PHASE);
        // 特殊投票不受阶段限制
        assertTrue(voteFacade.startVoting(VoteType.SPECIAL, null, Arrays.asList(1, 2)).isSuccess());

        phaseTracker.enter(PhaseEvent.VOTE, 2);
        assertReason(voteFacade.startVoting(VoteType.EXECUTION, Collections.emptyList(), null), VoteErrorCode.NO_VOTERS);
        assertReason(voteFacade.startVoting(VoteType.EXECUTION, null, Collections.emptyList()), VoteErrorCode.NO_TARGETS);
    }

    @Test
    void testCountWithoutRoundThrows() {
        VoteException e = assertThrows(VoteException.class, () -> voteFacade.countVotes());
        assertEquals(VoteErrorCode.NO_ACTIVE_ROUND, e.getErrorCode());
        assertReason(voteFacade.registerVote(1, 2), VoteErrorCode.NO_ACTIVE_ROUND);
    }

    @Test
    void testIdempotentRecountAndClosedRound() {
        phaseTracker.enter(PhaseEvent.VOTE, 2);
        voteFacade.startVoting(VoteType.EXECUTION);
        voteFacade.registerVote(1, 2);
        voteFacade.registerVote(2, 1);
        voteFacade.registerVote(3, 2);

        VoteCountResult first = voteFacade.countVotes();
        VoteCountResult second = voteFacade.countVotes();
        assertEquals(first.getTally(), second.getTally());
        assertEquals(first.isNeedsRunoff(), second.isNeedsRunoff());

        assertReason(voteFacade.registerVote(4, 2), VoteErrorCode.ROUND_CLOSED);
        assertReason(voteFacade.changeVote(1, 3), VoteErrorCode.ROUND_CLOSED);
    }

    @Test
    void testLastWriteWinsAndHistory() {
        phaseTracker.enter(PhaseEvent.VOTE, 2);
        voteFacade.startVoting(VoteType.EXECUTION);
        voteFacade.registerVote(1, 2);
        long firstTimestamp = voteFacade.getVote(1).getTimestamp();
        voteFacade.registerVote(1, 3);

        assertEquals(1, voteFacade.getCurrentVotes().size());
        BallotRecord live = voteFacade.getVote(1);
        assertEquals(3, live.getTargetId());
        assertTrue(live.getTimestamp() > firstTimestamp);

        List<BallotRecord> history = voteFacade.getPlayerVoteHistory(1);
        assertEquals(2, history.size(), "历史保留两次投票");
        assertEquals(2, history.get(0).getTargetId());
        assertEquals(3, history.get(1).getTargetId());

        Result<ChangeReceipt> same = voteFacade.changeVote(1, 3);
        assertTrue(same.getData().isUnchanged());
        assertEquals(2, voteFacade.getVoteHistory(2, VoteType.EXECUTION).size(), "未变更不追加历史");

        assertTrue(voteFacade.changeVote(1, 4).isSuccess());
        assertEquals(3, voteFacade.getVoteHistory(2, null).size());
        assertEquals(Collections.singletonList(1), voteFacade.getVotersOf(4));
    }

    @Test
    void testDeadVoterBallotKept() {
        phaseTracker.enter(PhaseEvent.VOTE, 2);
        voteFacade.startVoting(VoteType.EXECUTION);
        voteFacade.registerVote(1, 2);
        voteFacade.registerVote(5, 2);

        roster.kill(5, "hunter");

        assertNotNull(voteFacade.getVote(5), "死亡玩家的票仍留在本轮");
        assertEquals(2, voteFacade.getVoteHistory(2, VoteType.EXECUTION).stream()
                .filter(record -> record.getVoterId() == 5).count(), "死亡时再记录一次");
        assertEquals(Collections.singletonMap(2, 2), voteFacade.countVotes().getTally().getCounts());
        assertReason(voteFacade.registerVote(5, 2), VoteErrorCode.ROUND_CLOSED);
    }

    @Test
    void testExecuteTargetErrors() {
        phaseTracker.enter(PhaseEvent.VOTE, 2);
        assertReason(voteFacade.executeTarget(ExecutionDecision.execute(99)), VoteErrorCode.INVALID_TARGET);
        roster.kill(2, "night");
        assertReason(voteFacade.executeTarget(ExecutionDecision.execute(2)), VoteErrorCode.ALREADY_DEAD);
        assertReason(voteFacade.executeTarget(ExecutionDecision.executeAll(Collections.emptyList())), VoteErrorCode.NO_CANDIDATES);
        assertReason(voteFacade.startRunoff(Collections.emptyList()), VoteErrorCode.NO_CANDIDATES);
        assertReason(voteFacade.executeTarget(ExecutionDecision.runoff(Arrays.asList(3, 4))), VoteErrorCode.INVALID_PHASE);
    }

    @Test
    void testVisibleStatus() {
        phaseTracker.enter(PhaseEvent.VOTE, 2);
        voteFacade.startVoting(VoteType.EXECUTION);
        voteFacade.registerVote(1, 2);
        voteFacade.registerVote(3, 2);

        VoteStatus moderator = voteFacade.getVoteStatus(null);
        assertEquals(5, moderator.getTotalVoters());
        assertEquals(2, moderator.getSubmitted());
        assertEquals(Arrays.asList(2, 4, 5), moderator.getRemainingVoters());
        assertEquals(2, moderator.getVotes().size());

        VoteStatus player = voteFacade.getVoteStatus(3);
        assertNull(player.getVotes());
        assertEquals(2, player.getOwnVote().getTargetId());
        assertEquals(1, voteFacade.getVisibleVotes(1).size());
        assertEquals(Integer.valueOf(2), voteFacade.getVisibleCounts(null).get(2));
    }

    private void assertReason(Result<?> result, VoteErrorCode code) {
        assertTrue(result.isFailure(), "应当失败：" + code);
        assertEquals(code.name(), result.getReason());
    }

    private List<String> eventNames() {
        return applicationEvents.stream(VoteEvent.class).map(VoteEvent::getName).collect(Collectors.toList());
    }

    private VoteEvent findLast(String name) {
        return applicationEvents.stream(VoteEvent.class)
                .filter(e -> name.equals(e.getName()))
                .reduce((a, b) -> b)
                .orElseThrow();
    }
}
