package com.planningpoker.service;

import com.planningpoker.model.SessionJoinError;
import com.planningpoker.model.Vote;
import com.planningpoker.model.VotingSession;
import com.planningpoker.model.VotingState;
import com.planningpoker.protocol.PokerMessage;
import com.planningpoker.protocol.PokerMessage.ParticipantJoinAnnouncement;
import com.planningpoker.protocol.PokerMessage.ParticipantLeaveAnnouncement;
import com.planningpoker.protocol.PokerMessage.SessionInfoResponse;
import com.planningpoker.protocol.PokerMessage.SessionJoinErrorResponse;
import com.planningpoker.protocol.PokerMessage.VoteReceiptAnnouncement;
import com.planningpoker.protocol.PokerMessage.VotingIssueAnnouncement;
import com.planningpoker.protocol.PokerMessage.VotingResultsRevelation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class SessionRegistryTest {
    private static final Duration EVICTION_WINDOW = Duration.ofSeconds(20);

    private MutableClock clock;
    private SessionRegistry registry;
    private RecordingChannel alice;
    private RecordingChannel bob;
    private RecordingChannel carol;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
        AtomicInteger counter = new AtomicInteger();
        registry = new SessionRegistry(clock, () -> "id-" + counter.incrementAndGet(),
                new MedianOutcomePolicy(), EVICTION_WINDOW);
        alice = connect("p-alice");
        bob = connect("p-bob");
        carol = connect("p-carol");
    }

    private RecordingChannel connect(String participantId) {
        RecordingChannel channel = new RecordingChannel();
        registry.connect(participantId, channel);
        return channel;
    }

    private String createSessionAsAlice() {
        return registry.createSession("p-alice", "Alice").sessionId;
    }

    private String currentIssueId(String sessionId) {
        return registry.snapshot(sessionId).currentIssue.id;
    }

    // === Create ===

    @Test
    void create_session_has_only_the_creator_and_an_open_issue() {
        SessionInfoResponse info = registry.createSession("p-alice", "Alice");

        assertThat(info.currentParticipants).containsExactly("Alice");
        assertThat(info.currentIssue.getState()).isEqualTo(VotingState.OPENING);
        assertThat(info.currentIssue.getVotes()).isEmpty();
        assertThat(info.currentIssue.getOutcome()).isNull();
        assertThat(alice.messages).containsExactly(info);

        VotingSession session = registry.snapshot(info.sessionId);
        assertThat(session.participantNames()).containsExactly("Alice");
        assertThat(session.currentIssue.id).isEqualTo(info.currentIssue.id);
    }

    // === Join ===

    @Test
    void join_of_unknown_session_is_refused_without_side_effects() {
        String sessionId = createSessionAsAlice();
        alice.clear();

        PokerMessage result = registry.joinSession("no-such-session", "p-bob", "Bob");

        assertThat(result).isInstanceOf(SessionJoinErrorResponse.class);
        assertThat(((SessionJoinErrorResponse) result).error).isEqualTo(SessionJoinError.UNKNOWN_SESSION);
        assertThat(bob.last(SessionJoinErrorResponse.class).sessionId).isEqualTo("no-such-session");
        assertThat(registry.sessionCount()).isEqualTo(1);
        assertThat(registry.snapshot(sessionId).participantNames()).containsExactly("Alice");
        assertThat(alice.messages).isEmpty();
    }

    @Test
    void join_with_taken_name_is_refused_and_participants_unchanged() {
        String sessionId = createSessionAsAlice();

        PokerMessage result = registry.joinSession(sessionId, "p-bob", "Alice");

        assertThat(((SessionJoinErrorResponse) result).error).isEqualTo(SessionJoinError.PARTICIPANT_NAME_TAKEN);
        assertThat(registry.snapshot(sessionId).participantNames()).containsExactly("Alice");
    }

    @Test
    void name_check_is_case_sensitive() {
        String sessionId = createSessionAsAlice();

        PokerMessage result = registry.joinSession(sessionId, "p-bob", "alice");

        assertThat(result).isInstanceOf(SessionInfoResponse.class);
        assertThat(registry.snapshot(sessionId).participantNames()).containsExactly("Alice", "alice");
    }

    @Test
    void join_informs_the_joiner_and_announces_to_everyone_else() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        alice.clear();
        bob.clear();

        registry.joinSession(sessionId, "p-carol", "Carol");

        SessionInfoResponse info = carol.last(SessionInfoResponse.class);
        assertThat(info.currentParticipants).containsExactly("Alice", "Bob", "Carol");
        assertThat(carol.received(ParticipantJoinAnnouncement.class)).isEmpty();
        assertThat(alice.last(ParticipantJoinAnnouncement.class).participantName).isEqualTo("Carol");
        assertThat(bob.last(ParticipantJoinAnnouncement.class).participantName).isEqualTo("Carol");
    }

    // === Voting and reveal ===

    @Test
    void sole_participant_vote_reveals_immediately() {
        String sessionId = createSessionAsAlice();
        String issueId = currentIssueId(sessionId);

        registry.castVote(sessionId, issueId, "p-alice", Vote.FIVE);

        VotingResultsRevelation revelation = alice.last(VotingResultsRevelation.class);
        assertThat(revelation.issueId).isEqualTo(issueId);
        assertThat(revelation.votes).containsExactly(entry("Alice", Vote.FIVE));
        assertThat(revelation.outcome).isEqualTo(Vote.FIVE);
        assertThat(registry.snapshot(sessionId).currentIssue.getState()).isEqualTo(VotingState.CLOSING);
    }

    @Test
    void two_participants_see_receipts_then_a_single_revelation() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        String issueId = currentIssueId(sessionId);
        alice.clear();
        bob.clear();

        registry.castVote(sessionId, issueId, "p-alice", Vote.THREE);

        assertThat(alice.received(VoteReceiptAnnouncement.class)).hasSize(1);
        VoteReceiptAnnouncement receipt = bob.last(VoteReceiptAnnouncement.class);
        assertThat(receipt.participantName).isEqualTo("Alice");
        assertThat(receipt.issueId).isEqualTo(issueId);
        assertThat(alice.received(VotingResultsRevelation.class)).isEmpty();
        assertThat(bob.received(VotingResultsRevelation.class)).isEmpty();
        assertThat(registry.snapshot(sessionId).currentIssue.getState()).isEqualTo(VotingState.VOTING);

        registry.castVote(sessionId, issueId, "p-bob", Vote.EIGHT);

        for (RecordingChannel channel : new RecordingChannel[]{alice, bob}) {
            assertThat(channel.received(VotingResultsRevelation.class)).hasSize(1);
            VotingResultsRevelation revelation = channel.last(VotingResultsRevelation.class);
            assertThat(revelation.votes).containsOnly(entry("Alice", Vote.THREE), entry("Bob", Vote.EIGHT));
            // receipt for Bob's vote precedes the revelation
            assertThat(channel.messages.get(channel.messages.size() - 2)).isInstanceOf(VoteReceiptAnnouncement.class);
        }
    }

    @Test
    void changing_a_vote_overwrites_it() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        String issueId = currentIssueId(sessionId);

        registry.castVote(sessionId, issueId, "p-alice", Vote.THREE);
        registry.castVote(sessionId, issueId, "p-alice", Vote.THIRTEEN);
        registry.castVote(sessionId, issueId, "p-bob", Vote.THIRTEEN);

        assertThat(bob.last(VotingResultsRevelation.class).votes)
                .containsOnly(entry("Alice", Vote.THIRTEEN), entry("Bob", Vote.THIRTEEN));
    }

    @Test
    void joiner_sees_only_secrets_for_votes_already_cast() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        String issueId = currentIssueId(sessionId);
        registry.castVote(sessionId, issueId, "p-alice", Vote.FIVE);

        registry.joinSession(sessionId, "p-carol", "Carol");

        SessionInfoResponse info = carol.last(SessionInfoResponse.class);
        assertThat(info.currentIssue.getVotes()).containsExactly(entry("Alice", Vote.SECRET));
        assertThat(info.currentIssue.getOutcome()).isNull();
    }

    @Test
    void no_outbound_message_leaks_a_vote_before_reveal() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        registry.joinSession(sessionId, "p-carol", "Carol");
        String issueId = currentIssueId(sessionId);

        registry.castVote(sessionId, issueId, "p-alice", Vote.TWO);
        registry.castVote(sessionId, issueId, "p-bob", Vote.ONE);

        for (RecordingChannel channel : new RecordingChannel[]{alice, bob, carol}) {
            assertThat(channel.received(VotingResultsRevelation.class)).isEmpty();
            channel.received(SessionInfoResponse.class).forEach(info ->
                    assertThat(info.currentIssue.getVotes().values()).doesNotContain(Vote.ONE, Vote.TWO));
        }
    }

    @Test
    void stale_foreign_secret_and_late_votes_are_ignored() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        String issueId = currentIssueId(sessionId);
        alice.clear();
        bob.clear();

        registry.castVote(sessionId, "old-issue", "p-alice", Vote.FIVE);
        registry.castVote(sessionId, issueId, "p-carol", Vote.FIVE);
        registry.castVote(sessionId, issueId, "p-alice", Vote.SECRET);
        registry.castVote("no-such-session", issueId, "p-alice", Vote.FIVE);

        assertThat(alice.messages).isEmpty();
        assertThat(bob.messages).isEmpty();
        assertThat(registry.snapshot(sessionId).currentIssue.getVotes()).isEmpty();

        registry.castVote(sessionId, issueId, "p-alice", Vote.FIVE);
        registry.castVote(sessionId, issueId, "p-bob", Vote.ONE);
        bob.clear();

        registry.castVote(sessionId, issueId, "p-bob", Vote.INFINITE);

        assertThat(bob.messages).isEmpty();
        assertThat(registry.snapshot(sessionId).currentIssue.getVotes()).containsEntry("Bob", Vote.ONE);
    }

    @Test
    void abstaining_counts_as_voted() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        String issueId = currentIssueId(sessionId);

        registry.castVote(sessionId, issueId, "p-alice", Vote.UNKNOWN);
        registry.castVote(sessionId, issueId, "p-bob", Vote.EIGHT);

        VotingResultsRevelation revelation = alice.last(VotingResultsRevelation.class);
        assertThat(revelation.votes).containsEntry("Alice", Vote.UNKNOWN);
        assertThat(revelation.outcome).isEqualTo(Vote.EIGHT);
    }

    // === Topic change ===

    @Test
    void same_topic_is_a_no_op() {
        String sessionId = createSessionAsAlice();
        registry.changeTopic(sessionId, "p-alice", "PROJ-1");
        String issueId = currentIssueId(sessionId);
        alice.clear();

        registry.changeTopic(sessionId, "p-alice", "  PROJ-1 ");

        assertThat(currentIssueId(sessionId)).isEqualTo(issueId);
        assertThat(alice.messages).isEmpty();
    }

    @Test
    void blank_topic_on_a_fresh_session_is_a_no_op() {
        String sessionId = createSessionAsAlice();
        String issueId = currentIssueId(sessionId);
        alice.clear();

        registry.changeTopic(sessionId, "p-alice", "   ");

        assertThat(currentIssueId(sessionId)).isEqualTo(issueId);
        assertThat(alice.messages).isEmpty();
    }

    @Test
    void new_topic_replaces_the_issue_and_discards_votes() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        String oldIssueId = currentIssueId(sessionId);
        registry.castVote(sessionId, oldIssueId, "p-alice", Vote.FIVE);
        alice.clear();
        bob.clear();

        registry.changeTopic(sessionId, "p-bob", "PROJ-2");

        VotingSession session = registry.snapshot(sessionId);
        assertThat(session.currentIssue.id).isNotEqualTo(oldIssueId);
        assertThat(session.currentIssue.topicRef).isEqualTo("PROJ-2");
        assertThat(session.currentIssue.getVotes()).isEmpty();
        assertThat(session.currentIssue.getState()).isEqualTo(VotingState.OPENING);
        for (RecordingChannel channel : new RecordingChannel[]{alice, bob}) {
            VotingIssueAnnouncement announcement = channel.last(VotingIssueAnnouncement.class);
            assertThat(announcement.issue.id).isEqualTo(session.currentIssue.id);
            assertThat(announcement.issue.topicRef).isEqualTo("PROJ-2");
        }

        // votes for the superseded issue are dropped
        registry.castVote(sessionId, oldIssueId, "p-bob", Vote.FIVE);
        assertThat(registry.snapshot(sessionId).currentIssue.getVotes()).isEmpty();
    }

    @Test
    void topic_change_from_a_non_member_is_ignored() {
        String sessionId = createSessionAsAlice();
        String issueId = currentIssueId(sessionId);

        registry.changeTopic(sessionId, "p-carol", "PROJ-3");

        assertThat(currentIssueId(sessionId)).isEqualTo(issueId);
    }

    // === Disconnect ===

    @Test
    void leaving_is_announced_to_the_remaining_participants() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        alice.clear();

        registry.disconnect("p-bob", sessionId);

        assertThat(alice.last(ParticipantLeaveAnnouncement.class).participantName).isEqualTo("Bob");
        assertThat(registry.snapshot(sessionId).participantNames()).containsExactly("Alice");
        assertThat(registry.isConnected("p-bob")).isFalse();
        assertThat(registry.pendingEvictions()).isEmpty();
    }

    @Test
    void disconnect_of_the_last_non_voter_reveals() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        registry.joinSession(sessionId, "p-carol", "Carol");
        String issueId = currentIssueId(sessionId);
        registry.castVote(sessionId, issueId, "p-alice", Vote.TWO);
        registry.castVote(sessionId, issueId, "p-bob", Vote.THREE);
        alice.clear();

        registry.disconnect("p-carol", sessionId);

        assertThat(alice.messages.get(0)).isInstanceOf(ParticipantLeaveAnnouncement.class);
        VotingResultsRevelation revelation = alice.last(VotingResultsRevelation.class);
        assertThat(revelation.votes).containsOnly(entry("Alice", Vote.TWO), entry("Bob", Vote.THREE));
        assertThat(revelation.outcome).isEqualTo(Vote.TWO);
        assertThat(carol.received(VotingResultsRevelation.class)).isEmpty();
    }

    @Test
    void revelation_is_sent_only_once_per_issue() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        registry.joinSession(sessionId, "p-carol", "Carol");
        String issueId = currentIssueId(sessionId);
        registry.castVote(sessionId, issueId, "p-alice", Vote.TWO);
        registry.castVote(sessionId, issueId, "p-bob", Vote.THREE);
        registry.castVote(sessionId, issueId, "p-carol", Vote.FIVE);

        registry.disconnect("p-carol", sessionId);
        registry.castVote(sessionId, issueId, "p-bob", Vote.ONE);

        assertThat(alice.received(VotingResultsRevelation.class)).hasSize(1);
    }

    @Test
    void emptied_session_is_kept_for_the_eviction_window() {
        String sessionId = createSessionAsAlice();

        registry.disconnect("p-alice", sessionId);

        assertThat(registry.snapshot(sessionId)).isNotNull();
        assertThat(registry.snapshot(sessionId).isEmpty()).isTrue();
        assertThat(registry.pendingEvictions()).isEqualTo(Map.of(sessionId, clock.instant()));
    }

    @Test
    void rejoining_cancels_eviction_and_keeps_votes() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        String issueId = currentIssueId(sessionId);
        registry.castVote(sessionId, issueId, "p-alice", Vote.EIGHT);
        registry.disconnect("p-alice", sessionId);
        registry.disconnect("p-bob", sessionId);
        assertThat(registry.pendingEvictions()).containsKey(sessionId);

        RecordingChannel returning = connect("p-alice-2");
        PokerMessage result = registry.joinSession(sessionId, "p-alice-2", "Alice");

        assertThat(result).isInstanceOf(SessionInfoResponse.class);
        assertThat(registry.pendingEvictions()).isEmpty();
        // the vote slot is keyed by name, so the returning participant sees their own vote
        assertThat(returning.last(SessionInfoResponse.class).currentIssue.getVotes())
                .containsExactly(entry("Alice", Vote.EIGHT));
    }

    @Test
    void rejoin_that_completes_the_votes_reveals() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        String issueId = currentIssueId(sessionId);
        registry.castVote(sessionId, issueId, "p-alice", Vote.FIVE);
        registry.disconnect("p-alice", sessionId);
        registry.disconnect("p-bob", sessionId);

        RecordingChannel returning = connect("p-alice-2");
        registry.joinSession(sessionId, "p-alice-2", "Alice");

        assertThat(registry.snapshot(sessionId).currentIssue.getState()).isEqualTo(VotingState.CLOSING);
        VotingResultsRevelation revelation = returning.last(VotingResultsRevelation.class);
        assertThat(revelation.issueId).isEqualTo(issueId);
        assertThat(revelation.votes).containsExactly(entry("Alice", Vote.FIVE));
        assertThat(revelation.outcome).isEqualTo(Vote.FIVE);
        assertThat(returning.messages.get(0)).isInstanceOf(SessionInfoResponse.class);
    }

    @Test
    void joining_without_a_vote_does_not_reveal() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        registry.castVote(sessionId, currentIssueId(sessionId), "p-alice", Vote.THREE);

        registry.joinSession(sessionId, "p-carol", "Carol");

        assertThat(registry.snapshot(sessionId).currentIssue.getState()).isEqualTo(VotingState.VOTING);
        assertThat(alice.received(VotingResultsRevelation.class)).isEmpty();
        assertThat(carol.received(VotingResultsRevelation.class)).isEmpty();
    }

    @Test
    void zero_eviction_window_deletes_immediately() {
        AtomicInteger counter = new AtomicInteger();
        registry = new SessionRegistry(clock, () -> "s-" + counter.incrementAndGet(), new MedianOutcomePolicy(), Duration.ZERO);
        registry.connect("p-alice", alice);
        String sessionId = registry.createSession("p-alice", "Alice").sessionId;

        registry.disconnect("p-alice", sessionId);

        assertThat(registry.snapshot(sessionId)).isNull();
        assertThat(registry.pendingEvictions()).isEmpty();
    }

    @Test
    void disconnect_outside_a_session_only_drops_the_channel() {
        String sessionId = createSessionAsAlice();

        registry.disconnect("p-carol", null);
        registry.disconnect("p-bob", sessionId);

        assertThat(registry.isConnected("p-carol")).isFalse();
        assertThat(registry.isConnected("p-bob")).isFalse();
        assertThat(registry.snapshot(sessionId).participantNames()).containsExactly("Alice");
    }

    @Test
    void messages_to_disconnected_participants_are_dropped() {
        String sessionId = createSessionAsAlice();
        registry.joinSession(sessionId, "p-bob", "Bob");
        // channel gone but participant still listed, as when the disconnect is still queued
        registry.disconnect("p-bob", null);
        bob.clear();

        registry.changeTopic(sessionId, "p-alice", "PROJ-9");

        assertThat(bob.messages).isEmpty();
        assertThat(alice.last(VotingIssueAnnouncement.class)).isNotNull();
    }

    @Test
    void a_failing_channel_does_not_stop_the_broadcast() {
        String sessionId = createSessionAsAlice();
        registry.connect("p-broken", new ParticipantChannel() {
            @Override
            public void send(PokerMessage message) {
                throw new IllegalStateException("socket gone");
            }

            @Override
            public void close() {
            }
        });
        registry.joinSession(sessionId, "p-broken", "Broken");
        registry.joinSession(sessionId, "p-bob", "Bob");

        registry.changeTopic(sessionId, "p-alice", "PROJ-4");

        assertThat(bob.last(VotingIssueAnnouncement.class).issue.topicRef).isEqualTo("PROJ-4");
    }

    @Test
    void close_all_closes_channels_and_forgets_sessions() {
        createSessionAsAlice();

        registry.closeAll();

        assertThat(alice.closed).isTrue();
        assertThat(bob.closed).isTrue();
        assertThat(registry.sessionCount()).isZero();
        assertThat(registry.isConnected("p-alice")).isFalse();
    }
}
