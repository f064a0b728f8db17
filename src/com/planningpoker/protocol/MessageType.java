package com.planningpoker.protocol;

/**
 * Wire discriminants of {@link PokerMessage} variants, carried in the {@code "type"} field.
 */
public enum MessageType {
    CREATE_SESSION_REQUEST("CreateSessionRequest", true),
    JOIN_SESSION_REQUEST("JoinSessionRequest", true),
    SESSION_INFO_RESPONSE("SessionInfoResponse", false),
    SESSION_JOIN_ERROR_RESPONSE("SessionJoinErrorResponse", false),
    PARTICIPANT_JOIN_ANNOUNCEMENT("ParticipantJoinAnnouncement", false),
    PARTICIPANT_LEAVE_ANNOUNCEMENT("ParticipantLeaveAnnouncement", false),
    TOPIC_CHANGE_REQUEST("TopicChangeRequest", true),
    VOTING_ISSUE_ANNOUNCEMENT("VotingIssueAnnouncement", false),
    VOTE_REQUEST("VoteRequest", true),
    VOTE_RECEIPT_ANNOUNCEMENT("VoteReceiptAnnouncement", false),
    VOTING_RESULTS_REVELATION("VotingResultsRevelation", false);

    private final String wireName;
    private final boolean clientRequest;

    MessageType(String wireName, boolean clientRequest) {
        this.wireName = wireName;
        this.clientRequest = clientRequest;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * True for messages a client may send to the server.
     */
    public boolean isClientRequest() {
        return clientRequest;
    }

    public static MessageType fromWireName(String wireName) {
        for (MessageType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        return null;
    }
}
