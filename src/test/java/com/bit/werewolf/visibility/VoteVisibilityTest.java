package com.bit.werewolf.visibility;

import com.bit.werewolf.structure.dto.VisibleVote;
import com.bit.werewolf.structure.dto.VoteStatus;
import com.bit.werewolf.structure.vote.Ballot;
import com.bit.werewolf.structure.vote.VoteType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class VoteVisibilityTest {

    private VoteVisibility visibility;

    private List<Ballot> ballots;

    @BeforeEach
    void setUp() {
        visibility = new VoteVisibility();
        ballots = Arrays.asList(
                Ballot.create(1, 3, VoteType.EXECUTION, 2),
                Ballot.create(2, 3, VoteType.EXECUTION, 2, 2),
                Ballot.create(4, 1, VoteType.EXECUTION, 2));
    }

    @Test
    void testModeratorSeesEverything() {
        List<VisibleVote> votes = visibility.getVisibleVotes(ballots, null, false);
        assertEquals(3, votes.size());
        assertEquals(2, votes.get(1).getVoterId());
        assertEquals(2, votes.get(1).getWeight());
    }

    @Test
    void testPlayerSeesOnlyOwnVoteByDefault() {
        List<VisibleVote> votes = visibility.getVisibleVotes(ballots, 2, false);
        assertEquals(1, votes.size());
        assertEquals(2, votes.get(0).getVoterId());
        assertTrue(visibility.getVisibleVotes(ballots, 9, false).isEmpty());
    }

    @Test
    void testAnonymousUntilEnd() {
        visibility.configure(VisibilitySettings.builder().showRealTimeVotes(true).anonymousUntilEnd(true).build());

        List<VisibleVote> during = visibility.getVisibleVotes(ballots, 4, false);
        assertEquals(3, during.size());
        assertTrue(during.stream().allMatch(v -> v.getVoterId() == null), "投票结束前隐藏投票者");

        List<VisibleVote> after = visibility.getVisibleVotes(ballots, 4, true);
        assertTrue(after.stream().allMatch(v -> v.getVoterId() != null));
    }

    @Test
    void testHiddenCounts() {
        Map<Integer, Integer> counts = Collections.singletonMap(3, 3);
        visibility.configure(VisibilitySettings.builder().showVoteCount(false).build());
        assertTrue(visibility.getVisibleCounts(counts, 1).isEmpty());
        assertEquals(counts, visibility.getVisibleCounts(counts, null));
    }

    @Test
    void testVisibleStatus() {
        VoteStatus status = VoteStatus.builder().active(true).type(VoteType.EXECUTION).turn(2)
                .totalVoters(4).submitted(3).complete(false).remainingVoters(Collections.singletonList(3)).build();

        VoteStatus moderator = visibility.getVisibleStatus(status, ballots, null);
        assertEquals(3, moderator.getVotes().size());

        VoteStatus player = visibility.getVisibleStatus(status, ballots, 1);
        assertNull(player.getVotes());
        assertNotNull(player.getOwnVote());
        assertEquals(3, player.getOwnVote().getTargetId());

        visibility.configure(VisibilitySettings.builder().showRealTimeVotes(true).anonymousUntilEnd(true).build());
        VoteStatus anonymous = visibility.getVisibleStatus(status, ballots, 1);
        assertNull(anonymous.getVotes());
        assertEquals(Integer.valueOf(3), anonymous.getCounts().get(3));
        assertEquals(Integer.valueOf(1), anonymous.getCounts().get(1));
    }
}
