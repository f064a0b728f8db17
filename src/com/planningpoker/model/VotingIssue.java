package com.planningpoker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The topic currently open for estimation in a session.
 * Votes are keyed by participant name and kept in the order they were first cast.
 */
public class VotingIssue {
    public final String id;
    public final String topicRef; // nullable, e.g. a ticket id
    private VotingState state;
    private Vote outcome; // null until CLOSING
    private final Map<String, Vote> votes;

    public VotingIssue(String id, String topicRef) {
        this(id, topicRef, VotingState.OPENING, null, new LinkedHashMap<>());
    }

    public VotingIssue(String id, String topicRef, VotingState state, Vote outcome, Map<String, Vote> votes) {
        this.id = id;
        this.topicRef = topicRef;
        this.state = state;
        this.outcome = outcome;
        this.votes = new LinkedHashMap<>(votes);
    }

    public VotingState getState() {
        return state;
    }

    public Vote getOutcome() {
        return outcome;
    }

    public boolean isClosed() {
        return state == VotingState.CLOSING;
    }

    /**
     * Read-only view of the stored votes.
     */
    public Map<String, Vote> getVotes() {
        return Collections.unmodifiableMap(votes);
    }

    /**
     * Stores (or overwrites) the vote of the given participant.
     * The first vote moves the issue from OPENING to VOTING.
     */
    public void recordVote(String participantName, Vote vote) {
        if (isClosed()) {
            throw new IllegalStateException("Issue " + id + " is already closed");
        }
        if (vote == Vote.SECRET) {
            throw new IllegalArgumentException("SECRET is not a castable vote");
        }
        votes.put(participantName, vote);
        state = VotingState.VOTING;
    }

    public boolean hasVoteFrom(String participantName) {
        return votes.containsKey(participantName);
    }

    public void close(Vote outcome) {
        this.state = VotingState.CLOSING;
        this.outcome = outcome;
    }

    /**
     * Renders the issue for one recipient. Until the issue is closed every vote
     * except the recipient's own is replaced with SECRET.
     */
    public VotingIssue blindedFor(String recipientName) {
        if (isClosed()) {
            return copy();
        }
        Map<String, Vote> blinded = new LinkedHashMap<>();
        votes.forEach((name, vote) -> blinded.put(name, name.equals(recipientName) ? vote : Vote.SECRET));
        return new VotingIssue(id, topicRef, state, null, blinded);
    }

    public VotingIssue copy() {
        return new VotingIssue(id, topicRef, state, outcome, votes);
    }

    @Override
    public String toString() {
        return "VotingIssue{" +
                "id='" + id + '\'' +
                ", topicRef='" + topicRef + '\'' +
                ", state=" + state +
                ", outcome=" + outcome +
                ", votes=" + votes.size() +
                '}';
    }
}
