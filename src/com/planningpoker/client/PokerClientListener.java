package com.planningpoker.client;

import com.planningpoker.protocol.PokerMessage;

/**
 * Callbacks of a {@link PokerClient}. Invoked on OkHttp's WebSocket reader thread.
 */
public interface PokerClientListener {
    void onMessage(PokerMessage message);

    default void onClosed(int code, String reason) {
    }

    default void onFailure(Throwable error) {
    }
}
