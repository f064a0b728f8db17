package com.planningpoker.protocol;

/**
 * Thrown when an inbound frame cannot be turned into a {@link PokerMessage}.
 */
public class MalformedMessageException extends Exception {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
