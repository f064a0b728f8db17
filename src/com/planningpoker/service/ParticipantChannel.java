package com.planningpoker.service;

import com.planningpoker.protocol.PokerMessage;

/**
 * Outbound route from the coordinator to one connected participant.
 * Implementations must deliver messages in the order {@link #send} is called.
 */
public interface ParticipantChannel {
    void send(PokerMessage message);

    /**
     * Closes the underlying connection. Called when the coordinator shuts down.
     */
    void close();
}
