package com.planningpoker.model;

/**
 * Lifecycle of a voting issue: OPENING until the first vote, VOTING afterwards, CLOSING once revealed.
 */
public enum VotingState {
    OPENING("Opening"),
    VOTING("Voting"),
    CLOSING("Closing");

    private final String wireName;

    VotingState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static VotingState fromWireName(String wireName) {
        for (VotingState state : values()) {
            if (state.wireName.equals(wireName)) {
                return state;
            }
        }
        return null;
    }
}
