package com.planningpoker.service;

import com.planningpoker.model.Participant;
import com.planningpoker.model.SessionJoinError;
import com.planningpoker.model.Vote;
import com.planningpoker.model.VotingIssue;
import com.planningpoker.model.VotingSession;
import com.planningpoker.protocol.PokerMessage;
import com.planningpoker.protocol.PokerMessage.ParticipantJoinAnnouncement;
import com.planningpoker.protocol.PokerMessage.ParticipantLeaveAnnouncement;
import com.planningpoker.protocol.PokerMessage.SessionInfoResponse;
import com.planningpoker.protocol.PokerMessage.SessionJoinErrorResponse;
import com.planningpoker.protocol.PokerMessage.VoteReceiptAnnouncement;
import com.planningpoker.protocol.PokerMessage.VotingIssueAnnouncement;
import com.planningpoker.protocol.PokerMessage.VotingResultsRevelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owns every voting session and the outbound channel of every connected participant.
 * <ul>
 *   <li>creates and joins sessions, enforcing session-unique participant names</li>
 *   <li>replaces the current issue on topic change</li>
 *   <li>records votes and reveals them once every participant has voted</li>
 *   <li>marks emptied sessions for eviction</li>
 * </ul>
 *
 * Not thread-safe: all calls must come from the {@link SessionCoordinator} thread.
 */
public class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, ParticipantChannel> channels = new HashMap<>();
    private final Map<String, VotingSession> sessions = new HashMap<>();
    // Key: session ID, Value: when the session became empty
    private final Map<String, Instant> pendingEvictions = new LinkedHashMap<>();

    private final Clock clock;
    private final Supplier<String> ids;
    private final OutcomePolicy outcomePolicy;
    private final Duration evictionWindow;

    public SessionRegistry(Clock clock, Supplier<String> ids, OutcomePolicy outcomePolicy, Duration evictionWindow) {
        this.clock = clock;
        this.ids = ids;
        this.outcomePolicy = outcomePolicy;
        this.evictionWindow = evictionWindow;
    }

    public void connect(String participantId, ParticipantChannel channel) {
        channels.put(participantId, channel);
        log.debug("Participant {} connected ({} connections)", participantId, channels.size());
    }

    public SessionInfoResponse createSession(String participantId, String participantName) {
        VotingSession session = new VotingSession(ids.get(), new VotingIssue(ids.get(), null));
        session.participants.add(new Participant(participantId, participantName, clock.instant()));
        sessions.put(session.id, session);
        log.info("Session {} created by {}", session.id, participantName);

        SessionInfoResponse info = sessionInfoFor(session, participantName);
        send(participantId, info);
        return info;
    }

    /**
     * @return the {@link SessionInfoResponse} sent to the joiner, or the
     * {@link SessionJoinErrorResponse} explaining why the join was refused
     */
    public PokerMessage joinSession(String sessionId, String participantId, String participantName) {
        VotingSession session = sessions.get(sessionId);
        if (session == null) {
            return refuseJoin(sessionId, participantId, SessionJoinError.UNKNOWN_SESSION);
        }
        if (session.hasParticipantNamed(participantName)) {
            return refuseJoin(sessionId, participantId, SessionJoinError.PARTICIPANT_NAME_TAKEN);
        }

        if (pendingEvictions.remove(sessionId) != null) {
            log.info("Session {} rejoined before eviction", sessionId);
        }
        List<Participant> alreadyPresent = new ArrayList<>(session.participants);
        session.participants.add(new Participant(participantId, participantName, clock.instant()));
        log.info("{} joined session {} ({} participants)", participantName, sessionId, session.participants.size());

        SessionInfoResponse info = sessionInfoFor(session, participantName);
        send(participantId, info);
        ParticipantJoinAnnouncement announcement = new ParticipantJoinAnnouncement(participantName);
        alreadyPresent.forEach(p -> send(p.id, announcement));
        // a returning name may bring back the last missing vote
        revealIfComplete(session);
        return info;
    }

    public void changeTopic(String sessionId, String participantId, String topicRef) {
        VotingSession session = sessions.get(sessionId);
        if (session == null || session.findParticipant(participantId) == null) {
            log.debug("Dropping topic change from {} for session {}", participantId, sessionId);
            return;
        }
        String topic = normalizeTopic(topicRef);
        if (Objects.equals(topic, session.currentIssue.topicRef)) {
            return;
        }

        session.currentIssue = new VotingIssue(ids.get(), topic);
        log.info("Session {} now voting on {} (issue {})", sessionId, topic, session.currentIssue.id);
        broadcast(session, p -> new VotingIssueAnnouncement(session.currentIssue.blindedFor(p.name)));
    }

    public void castVote(String sessionId, String issueId, String participantId, Vote vote) {
        VotingSession session = sessions.get(sessionId);
        if (session == null) {
            log.debug("Dropping vote from {} for unknown session {}", participantId, sessionId);
            return;
        }
        VotingIssue issue = session.currentIssue;
        Participant voter = session.findParticipant(participantId);
        if (voter == null || !issue.id.equals(issueId) || issue.isClosed() || vote == null || vote == Vote.SECRET) {
            log.debug("Dropping vote from {} on issue {} in session {}", participantId, issueId, sessionId);
            return;
        }

        issue.recordVote(voter.name, vote);
        VoteReceiptAnnouncement receipt = new VoteReceiptAnnouncement(voter.name, issue.id);
        broadcast(session, p -> receipt);
        revealIfComplete(session);
    }

    /**
     * Forgets the participant's channel and removes them from the session they were in, if any.
     */
    public void disconnect(String participantId, String sessionId) {
        channels.remove(participantId);
        VotingSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            log.debug("Participant {} disconnected outside of any session", participantId);
            return;
        }
        Participant leaving = session.findParticipant(participantId);
        if (leaving == null) {
            return;
        }

        session.participants.remove(leaving);
        log.info("{} left session {}", leaving.name, sessionId);
        if (session.isEmpty()) {
            if (evictionWindow.isZero()) {
                evict(sessionId);
            } else {
                pendingEvictions.put(sessionId, clock.instant());
                log.info("Session {} is empty, evicting in {}s unless rejoined", sessionId, evictionWindow.toSeconds());
            }
            return;
        }

        ParticipantLeaveAnnouncement announcement = new ParticipantLeaveAnnouncement(leaving.name);
        broadcast(session, p -> announcement);
        revealIfComplete(session);
    }

    public void evict(String sessionId) {
        pendingEvictions.remove(sessionId);
        if (sessions.remove(sessionId) != null) {
            log.info("Session {} evicted", sessionId);
        }
    }

    /**
     * Closes every connected channel and drops all sessions.
     */
    public void closeAll() {
        log.info("Closing {} connections and {} sessions", channels.size(), sessions.size());
        new ArrayList<>(channels.values()).forEach(channel -> {
            try {
                channel.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close channel", e);
            }
        });
        channels.clear();
        sessions.clear();
        pendingEvictions.clear();
    }

    // --- queries ---

    /**
     * Sessions that are currently empty, with the instant they became empty.
     */
    public Map<String, Instant> pendingEvictions() {
        return Collections.unmodifiableMap(pendingEvictions);
    }

    public Duration evictionWindow() {
        return evictionWindow;
    }

    /**
     * @return a copy of the session, or null if no session has that id
     */
    public VotingSession snapshot(String sessionId) {
        VotingSession session = sessions.get(sessionId);
        return session == null ? null : session.copy();
    }

    public boolean isConnected(String participantId) {
        return channels.containsKey(participantId);
    }

    public int sessionCount() {
        return sessions.size();
    }

    // --- internals ---

    private void revealIfComplete(VotingSession session) {
        VotingIssue issue = session.currentIssue;
        if (issue.isClosed() || !session.everyoneVoted()) {
            return;
        }
        Vote outcome = outcomePolicy.outcomeOf(issue.getVotes().values());
        issue.close(outcome);
        log.info("Issue {} in session {} revealed with outcome {}", issue.id, session.id, outcome);

        VotingResultsRevelation revelation = new VotingResultsRevelation(issue.id, issue.getVotes(), outcome);
        broadcast(session, p -> revelation);
    }

    private SessionJoinErrorResponse refuseJoin(String sessionId, String participantId, SessionJoinError error) {
        log.info("Join of session {} by {} refused: {}", sessionId, participantId, error);
        SessionJoinErrorResponse response = new SessionJoinErrorResponse(sessionId, error);
        send(participantId, response);
        return response;
    }

    private SessionInfoResponse sessionInfoFor(VotingSession session, String recipientName) {
        return new SessionInfoResponse(session.id,
                session.currentIssue.blindedFor(recipientName),
                session.participantNames());
    }

    private void broadcast(VotingSession session, Function<Participant, PokerMessage> messageFor) {
        for (Participant participant : new ArrayList<>(session.participants)) {
            send(participant.id, messageFor.apply(participant));
        }
    }

    private void send(String participantId, PokerMessage message) {
        ParticipantChannel channel = channels.get(participantId);
        if (channel == null) {
            log.debug("No channel for participant {}, dropping {}", participantId, message);
            return;
        }
        try {
            channel.send(message);
        } catch (RuntimeException e) {
            log.warn("Failed to deliver {} to participant {}", message, participantId, e);
        }
    }

    static String normalizeTopic(String topicRef) {
        if (topicRef == null || topicRef.isBlank()) {
            return null;
        }
        return topicRef.trim();
    }
}
