package com.planningpoker.model;

/**
 * Reasons a join request can be refused.
 */
public enum SessionJoinError {
    UNKNOWN_SESSION("UnknownSession"),
    PARTICIPANT_NAME_TAKEN("ParticipantNameTaken");

    private final String wireName;

    SessionJoinError(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static SessionJoinError fromWireName(String wireName) {
        for (SessionJoinError error : values()) {
            if (error.wireName.equals(wireName)) {
                return error;
            }
        }
        return null;
    }
}
