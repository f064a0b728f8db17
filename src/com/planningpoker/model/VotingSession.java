package com.planningpoker.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A planning poker room: its participants in join order and the issue they are voting on.
 */
public class VotingSession {
    public final String id;
    public final List<Participant> participants = new ArrayList<>();
    public VotingIssue currentIssue;

    public VotingSession(String id, VotingIssue currentIssue) {
        this.id = id;
        this.currentIssue = currentIssue;
    }

    public Participant findParticipant(String participantId) {
        return participants.stream()
                .filter(p -> p.id.equals(participantId))
                .findFirst()
                .orElse(null);
    }

    public boolean hasParticipantNamed(String name) {
        return participants.stream().anyMatch(p -> p.name.equals(name));
    }

    public List<String> participantNames() {
        return participants.stream()
                .map(p -> p.name)
                .collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return participants.isEmpty();
    }

    /**
     * True when every current participant has a vote on the current issue.
     * An empty session is never considered fully voted.
     */
    public boolean everyoneVoted() {
        return !participants.isEmpty()
                && participants.stream().allMatch(p -> currentIssue.hasVoteFrom(p.name));
    }

    /**
     * Deep copy, safe to hand out of the coordinator thread.
     */
    public VotingSession copy() {
        VotingSession copy = new VotingSession(id, currentIssue.copy());
        copy.participants.addAll(participants);
        return copy;
    }
}
