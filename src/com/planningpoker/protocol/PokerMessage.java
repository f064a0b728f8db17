package com.planningpoker.protocol;

import com.planningpoker.model.SessionJoinError;
import com.planningpoker.model.Vote;
import com.planningpoker.model.VotingIssue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Messages exchanged between clients and the session coordinator.
 * Each variant reports its {@link MessageType}; receivers switch on it.
 *
 * Participant and session ids of the sender are never part of a request:
 * the connection supplies them.
 */
public abstract class PokerMessage {

    private PokerMessage() {
    }

    public abstract MessageType type();

    @Override
    public String toString() {
        return type().wireName();
    }

    public static class CreateSessionRequest extends PokerMessage {
        public final String participantName;

        public CreateSessionRequest(String participantName) {
            this.participantName = participantName;
        }

        @Override
        public MessageType type() {
            return MessageType.CREATE_SESSION_REQUEST;
        }
    }

    public static class JoinSessionRequest extends PokerMessage {
        public final String sessionId;
        public final String participantName;

        public JoinSessionRequest(String sessionId, String participantName) {
            this.sessionId = sessionId;
            this.participantName = participantName;
        }

        @Override
        public MessageType type() {
            return MessageType.JOIN_SESSION_REQUEST;
        }
    }

    public static class SessionInfoResponse extends PokerMessage {
        public final String sessionId;
        public final VotingIssue currentIssue;
        public final List<String> currentParticipants;

        public SessionInfoResponse(String sessionId, VotingIssue currentIssue, List<String> currentParticipants) {
            this.sessionId = sessionId;
            this.currentIssue = currentIssue;
            this.currentParticipants = List.copyOf(currentParticipants);
        }

        @Override
        public MessageType type() {
            return MessageType.SESSION_INFO_RESPONSE;
        }
    }

    public static class SessionJoinErrorResponse extends PokerMessage {
        public final String sessionId;
        public final SessionJoinError error;

        public SessionJoinErrorResponse(String sessionId, SessionJoinError error) {
            this.sessionId = sessionId;
            this.error = error;
        }

        @Override
        public MessageType type() {
            return MessageType.SESSION_JOIN_ERROR_RESPONSE;
        }
    }

    public static class ParticipantJoinAnnouncement extends PokerMessage {
        public final String participantName;

        public ParticipantJoinAnnouncement(String participantName) {
            this.participantName = participantName;
        }

        @Override
        public MessageType type() {
            return MessageType.PARTICIPANT_JOIN_ANNOUNCEMENT;
        }
    }

    public static class ParticipantLeaveAnnouncement extends PokerMessage {
        public final String participantName;

        public ParticipantLeaveAnnouncement(String participantName) {
            this.participantName = participantName;
        }

        @Override
        public MessageType type() {
            return MessageType.PARTICIPANT_LEAVE_ANNOUNCEMENT;
        }
    }

    public static class TopicChangeRequest extends PokerMessage {
        public final String topicRef; // nullable

        public TopicChangeRequest(String topicRef) {
            this.topicRef = topicRef;
        }

        @Override
        public MessageType type() {
            return MessageType.TOPIC_CHANGE_REQUEST;
        }
    }

    public static class VotingIssueAnnouncement extends PokerMessage {
        public final VotingIssue issue;

        public VotingIssueAnnouncement(VotingIssue issue) {
            this.issue = issue;
        }

        @Override
        public MessageType type() {
            return MessageType.VOTING_ISSUE_ANNOUNCEMENT;
        }
    }

    public static class VoteRequest extends PokerMessage {
        public final String issueId;
        public final Vote vote;

        public VoteRequest(String issueId, Vote vote) {
            this.issueId = issueId;
            this.vote = vote;
        }

        @Override
        public MessageType type() {
            return MessageType.VOTE_REQUEST;
        }
    }

    public static class VoteReceiptAnnouncement extends PokerMessage {
        public final String participantName;
        public final String issueId;

        public VoteReceiptAnnouncement(String participantName, String issueId) {
            this.participantName = participantName;
            this.issueId = issueId;
        }

        @Override
        public MessageType type() {
            return MessageType.VOTE_RECEIPT_ANNOUNCEMENT;
        }
    }

    public static class VotingResultsRevelation extends PokerMessage {
        public final String issueId;
        public final Map<String, Vote> votes;
        public final Vote outcome;

        public VotingResultsRevelation(String issueId, Map<String, Vote> votes, Vote outcome) {
            this.issueId = issueId;
            this.votes = Collections.unmodifiableMap(new LinkedHashMap<>(votes));
            this.outcome = outcome;
        }

        @Override
        public MessageType type() {
            return MessageType.VOTING_RESULTS_REVELATION;
        }
    }
}
