package com.planningpoker.client;

import com.planningpoker.model.Vote;
import com.planningpoker.protocol.MalformedMessageException;
import com.planningpoker.protocol.PokerMessage;
import com.planningpoker.protocol.PokerMessage.CreateSessionRequest;
import com.planningpoker.protocol.PokerMessage.JoinSessionRequest;
import com.planningpoker.protocol.PokerMessage.TopicChangeRequest;
import com.planningpoker.protocol.PokerMessage.VoteRequest;
import com.planningpoker.protocol.PokerMessageCodec;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket client for the planning poker protocol, e.g. {@code ws://localhost:8080/ws}.
 */
public class PokerClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PokerClient.class);
    private static final int NORMAL_CLOSURE = 1000;

    private final OkHttpClient client;
    private final WebSocket webSocket;

    private PokerClient(OkHttpClient client, String url, PokerClientListener listener) {
        this.client = client;
        Request request = new Request.Builder()
                .url(url)
                .build();
        this.webSocket = client.newWebSocket(request, new DecodingListener(listener));
    }

    /**
     * Opens a connection. Messages sent before the handshake completes are queued by OkHttp.
     */
    public static PokerClient connect(String url, PokerClientListener listener) {
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(0, TimeUnit.SECONDS)
                .pingInterval(5, TimeUnit.SECONDS)
                .build();
        return new PokerClient(client, url, listener);
    }

    public void createSession(String participantName) throws IOException {
        send(new CreateSessionRequest(participantName));
    }

    public void joinSession(String sessionId, String participantName) throws IOException {
        send(new JoinSessionRequest(sessionId, participantName));
    }

    public void changeTopic(String topicRef) throws IOException {
        send(new TopicChangeRequest(topicRef));
    }

    public void vote(String issueId, Vote vote) throws IOException {
        send(new VoteRequest(issueId, vote));
    }

    /**
     * @throws IOException if the socket is closed or its outgoing queue is full
     */
    public void send(PokerMessage message) throws IOException {
        if (!webSocket.send(PokerMessageCodec.encode(message))) {
            throw new IOException("Could not send " + message + ": connection closed");
        }
    }

    @Override
    public void close() {
        webSocket.close(NORMAL_CLOSURE, "bye");
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private static class DecodingListener extends WebSocketListener {
        private final PokerClientListener listener;

        DecodingListener(PokerClientListener listener) {
            this.listener = listener;
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            PokerMessage message;
            try {
                message = PokerMessageCodec.decode(text);
            } catch (MalformedMessageException e) {
                log.warn("Could not decode server message: {}", e.getMessage());
                return;
            }
            listener.onMessage(message);
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            listener.onClosed(code, reason);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            log.warn("WebSocket failure: {}", t.getMessage());
            listener.onFailure(t);
        }
    }
}
