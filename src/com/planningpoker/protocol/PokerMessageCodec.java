package com.planningpoker.protocol;

import com.planningpoker.model.SessionJoinError;
import com.planningpoker.model.Vote;
import com.planningpoker.model.VotingIssue;
import com.planningpoker.model.VotingState;
import com.planningpoker.protocol.PokerMessage.CreateSessionRequest;
import com.planningpoker.protocol.PokerMessage.JoinSessionRequest;
import com.planningpoker.protocol.PokerMessage.ParticipantJoinAnnouncement;
import com.planningpoker.protocol.PokerMessage.ParticipantLeaveAnnouncement;
import com.planningpoker.protocol.PokerMessage.SessionInfoResponse;
import com.planningpoker.protocol.PokerMessage.SessionJoinErrorResponse;
import com.planningpoker.protocol.PokerMessage.TopicChangeRequest;
import com.planningpoker.protocol.PokerMessage.VoteReceiptAnnouncement;
import com.planningpoker.protocol.PokerMessage.VoteRequest;
import com.planningpoker.protocol.PokerMessage.VotingIssueAnnouncement;
import com.planningpoker.protocol.PokerMessage.VotingResultsRevelation;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of {@link PokerMessage}s.
 *
 * Every message is an object with a {@code "type"} discriminant and snake_case fields, e.g.
 * <pre>{"type":"VoteRequest","issue_id":"...","vote":"Five"}</pre>
 */
public final class PokerMessageCodec {
    static final String TYPE = "type";

    private PokerMessageCodec() {
    }

    public static String encode(PokerMessage message) {
        return toJson(message).toString();
    }

    static JSONObject toJson(PokerMessage message) {
        JSONObject json = new JSONObject();
        json.put(TYPE, message.type().wireName());
        switch (message.type()) {
            case CREATE_SESSION_REQUEST: {
                CreateSessionRequest m = (CreateSessionRequest) message;
                json.put("participant_name", m.participantName);
                break;
            }
            case JOIN_SESSION_REQUEST: {
                JoinSessionRequest m = (JoinSessionRequest) message;
                json.put("session_id", m.sessionId);
                json.put("participant_name", m.participantName);
                break;
            }
            case SESSION_INFO_RESPONSE: {
                SessionInfoResponse m = (SessionInfoResponse) message;
                json.put("session_id", m.sessionId);
                json.put("current_issue", issueToJson(m.currentIssue));
                json.put("current_participants", new JSONArray(m.currentParticipants));
                break;
            }
            case SESSION_JOIN_ERROR_RESPONSE: {
                SessionJoinErrorResponse m = (SessionJoinErrorResponse) message;
                json.put("session_id", m.sessionId);
                json.put("error", m.error.wireName());
                break;
            }
            case PARTICIPANT_JOIN_ANNOUNCEMENT:
                json.put("participant_name", ((ParticipantJoinAnnouncement) message).participantName);
                break;
            case PARTICIPANT_LEAVE_ANNOUNCEMENT:
                json.put("participant_name", ((ParticipantLeaveAnnouncement) message).participantName);
                break;
            case TOPIC_CHANGE_REQUEST:
                json.put("topic_ref", nullable(((TopicChangeRequest) message).topicRef));
                break;
            case VOTING_ISSUE_ANNOUNCEMENT:
                json.put("issue", issueToJson(((VotingIssueAnnouncement) message).issue));
                break;
            case VOTE_REQUEST: {
                VoteRequest m = (VoteRequest) message;
                json.put("issue_id", m.issueId);
                json.put("vote", m.vote.wireName());
                break;
            }
            case VOTE_RECEIPT_ANNOUNCEMENT: {
                VoteReceiptAnnouncement m = (VoteReceiptAnnouncement) message;
                json.put("participant_name", m.participantName);
                json.put("issue_id", m.issueId);
                break;
            }
            case VOTING_RESULTS_REVELATION: {
                VotingResultsRevelation m = (VotingResultsRevelation) message;
                json.put("issue_id", m.issueId);
                json.put("votes", votesToJson(m.votes));
                json.put("outcome", m.outcome == null ? JSONObject.NULL : m.outcome.wireName());
                break;
            }
            default:
                throw new IllegalArgumentException("No encoding for message type " + message.type());
        }
        return json;
    }

    /**
     * Parses one frame.
     *
     * @throws MalformedMessageException if the text is not JSON, the type is unknown,
     *                                   or a required field is missing or invalid
     */
    public static PokerMessage decode(String text) throws MalformedMessageException {
        JSONObject json;
        try {
            json = new JSONObject(text);
        } catch (JSONException e) {
            throw new MalformedMessageException("Not a JSON object: " + e.getMessage(), e);
        }

        String typeName = json.optString(TYPE, null);
        MessageType type = MessageType.fromWireName(typeName);
        if (type == null) {
            throw new MalformedMessageException("Unknown message type: " + typeName);
        }

        try {
            switch (type) {
                case CREATE_SESSION_REQUEST:
                    return new CreateSessionRequest(requireString(json, "participant_name"));
                case JOIN_SESSION_REQUEST:
                    return new JoinSessionRequest(requireString(json, "session_id"),
                            requireString(json, "participant_name"));
                case SESSION_INFO_RESPONSE:
                    return new SessionInfoResponse(requireString(json, "session_id"),
                            issueFromJson(json.getJSONObject("current_issue")),
                            stringList(json.getJSONArray("current_participants")));
                case SESSION_JOIN_ERROR_RESPONSE:
                    return new SessionJoinErrorResponse(requireString(json, "session_id"),
                            requireJoinError(json, "error"));
                case PARTICIPANT_JOIN_ANNOUNCEMENT:
                    return new ParticipantJoinAnnouncement(requireString(json, "participant_name"));
                case PARTICIPANT_LEAVE_ANNOUNCEMENT:
                    return new ParticipantLeaveAnnouncement(requireString(json, "participant_name"));
                case TOPIC_CHANGE_REQUEST:
                    return new TopicChangeRequest(json.optString("topic_ref", null));
                case VOTING_ISSUE_ANNOUNCEMENT:
                    return new VotingIssueAnnouncement(issueFromJson(json.getJSONObject("issue")));
                case VOTE_REQUEST:
                    return new VoteRequest(requireString(json, "issue_id"), requireVote(json, "vote"));
                case VOTE_RECEIPT_ANNOUNCEMENT:
                    return new VoteReceiptAnnouncement(requireString(json, "participant_name"),
                            requireString(json, "issue_id"));
                case VOTING_RESULTS_REVELATION:
                    return new VotingResultsRevelation(requireString(json, "issue_id"),
                            votesFromJson(json.getJSONObject("votes")),
                            optionalVote(json, "outcome"));
                default:
                    throw new MalformedMessageException("Unsupported message type: " + type);
            }
        } catch (JSONException e) {
            throw new MalformedMessageException("Invalid " + type.wireName() + ": " + e.getMessage(), e);
        }
    }

    // --- issue and vote helpers ---

    static JSONObject issueToJson(VotingIssue issue) {
        JSONObject json = new JSONObject();
        json.put("id", issue.id);
        json.put("state", issue.getState().wireName());
        json.put("topic_ref", nullable(issue.topicRef));
        json.put("outcome", issue.getOutcome() == null ? JSONObject.NULL : issue.getOutcome().wireName());
        json.put("votes", votesToJson(issue.getVotes()));
        return json;
    }

    static VotingIssue issueFromJson(JSONObject json) throws MalformedMessageException {
        String stateName = requireString(json, "state");
        VotingState state = VotingState.fromWireName(stateName);
        if (state == null) {
            throw new MalformedMessageException("Unknown voting state: " + stateName);
        }
        return new VotingIssue(requireString(json, "id"),
                json.optString("topic_ref", null),
                state,
                optionalVote(json, "outcome"),
                votesFromJson(json.getJSONObject("votes")));
    }

    private static JSONObject votesToJson(Map<String, Vote> votes) {
        JSONObject json = new JSONObject();
        votes.forEach((name, vote) -> json.put(name, vote.wireName()));
        return json;
    }

    private static Map<String, Vote> votesFromJson(JSONObject json) throws MalformedMessageException {
        Map<String, Vote> votes = new LinkedHashMap<>();
        for (String name : json.keySet()) {
            votes.put(name, requireVote(json, name));
        }
        return votes;
    }

    private static List<String> stringList(JSONArray array) {
        List<String> result = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            result.add(array.getString(i));
        }
        return result;
    }

    private static String requireString(JSONObject json, String key) throws MalformedMessageException {
        String value = json.optString(key, null);
        if (value == null) {
            throw new MalformedMessageException("Missing field '" + key + "'");
        }
        return value;
    }

    private static Vote requireVote(JSONObject json, String key) throws MalformedMessageException {
        String name = requireString(json, key);
        Vote vote = Vote.fromWireName(name);
        if (vote == null) {
            throw new MalformedMessageException("Unknown vote '" + name + "' in field '" + key + "'");
        }
        return vote;
    }

    private static Vote optionalVote(JSONObject json, String key) throws MalformedMessageException {
        return json.isNull(key) ? null : requireVote(json, key);
    }

    private static SessionJoinError requireJoinError(JSONObject json, String key) throws MalformedMessageException {
        String name = requireString(json, key);
        SessionJoinError error = SessionJoinError.fromWireName(name);
        if (error == null) {
            throw new MalformedMessageException("Unknown join error '" + name + "'");
        }
        return error;
    }

    private static Object nullable(String value) {
        return value == null ? JSONObject.NULL : value;
    }
}
