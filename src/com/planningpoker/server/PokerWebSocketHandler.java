package com.planningpoker.server;

import com.planningpoker.protocol.MalformedMessageException;
import com.planningpoker.protocol.MessageType;
import com.planningpoker.protocol.PokerMessage;
import com.planningpoker.protocol.PokerMessage.SessionInfoResponse;
import com.planningpoker.protocol.PokerMessageCodec;
import com.planningpoker.service.ParticipantChannel;
import com.planningpoker.service.SessionCoordinator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connects one WebSocket client to the {@link SessionCoordinator}.
 *
 * <p>Once the handshake completes the connection registers itself and receives a participant id.
 * Every inbound request is dispatched under that id and the session this connection is in.
 * Ids sent by the client are never used. When the channel goes inactive, whether from a close,
 * an error or a heartbeat timeout, the coordinator is told exactly once.
 *
 * <p>One instance per channel.
 */
public class PokerWebSocketHandler extends SimpleChannelInboundHandler<WebSocketFrame> {
    private static final Logger log = LoggerFactory.getLogger(PokerWebSocketHandler.class);

    private final SessionCoordinator coordinator;
    private final AtomicBoolean disconnected = new AtomicBoolean(false);
    private volatile String participantId;
    private volatile String sessionId;
    // set once a create or join is on its way, cleared if the join is refused
    private volatile boolean sessionRequested;

    public PokerWebSocketHandler(SessionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            participantId = coordinator.connect(new WebSocketParticipantChannel(ctx.channel()));
            log.info("Client {} connected as participant {}", ctx.channel().remoteAddress(), participantId);
        } else if (evt instanceof IdleStateEvent) {
            IdleState state = ((IdleStateEvent) evt).state();
            if (state == IdleState.READER_IDLE) {
                log.info("No heartbeat from {}, closing connection", ctx.channel().remoteAddress());
                ctx.close();
            } else if (state == IdleState.WRITER_IDLE && participantId != null) {
                ctx.writeAndFlush(new PingWebSocketFrame());
            }
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (frame instanceof TextWebSocketFrame) {
            handleText(ctx, ((TextWebSocketFrame) frame).text());
        } else {
            log.debug("Ignoring {} from {}", frame.getClass().getSimpleName(), ctx.channel().remoteAddress());
        }
    }

    private void handleText(ChannelHandlerContext ctx, String text) {
        String id = participantId;
        if (id == null) {
            log.warn("Frame from {} before handshake completed, ignoring", ctx.channel().remoteAddress());
            return;
        }

        PokerMessage message;
        try {
            message = PokerMessageCodec.decode(text);
        } catch (MalformedMessageException e) {
            log.warn("Malformed message from participant {}: {}", id, e.getMessage());
            return;
        }

        MessageType type = message.type();
        if (!type.isClientRequest()) {
            log.warn("Participant {} sent server-only message {}, ignoring", id, type.wireName());
            return;
        }
        if (type == MessageType.CREATE_SESSION_REQUEST || type == MessageType.JOIN_SESSION_REQUEST) {
            if (sessionRequested) {
                log.warn("Participant {} is already in a session, ignoring {}", id, type.wireName());
                return;
            }
            sessionRequested = true;
        }
        // session id is set by the coordinator thread once a create or join goes through
        coordinator.dispatch(id, () -> sessionId, message);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        disconnectOnce();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("WebSocket error for client {}", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }

    private void disconnectOnce() {
        String id = participantId;
        if (id != null && disconnected.compareAndSet(false, true)) {
            log.info("Participant {} disconnected", id);
            // session id is read on the coordinator thread so a create or join still queued is seen
            coordinator.disconnect(id, () -> sessionId);
        }
    }

    /**
     * Writes coordinator messages to the socket and remembers which session this connection joined.
     */
    private class WebSocketParticipantChannel implements ParticipantChannel {
        private final Channel channel;

        WebSocketParticipantChannel(Channel channel) {
            this.channel = channel;
        }

        @Override
        public void send(PokerMessage message) {
            if (message.type() == MessageType.SESSION_INFO_RESPONSE) {
                sessionId = ((SessionInfoResponse) message).sessionId;
            } else if (message.type() == MessageType.SESSION_JOIN_ERROR_RESPONSE) {
                sessionRequested = false;
            }
            channel.writeAndFlush(new TextWebSocketFrame(PokerMessageCodec.encode(message)))
                    .addListener(future -> {
                        if (!future.isSuccess()) {
                            log.debug("Could not deliver {} to participant {}", message, participantId, future.cause());
                        }
                    });
        }

        @Override
        public void close() {
            channel.close();
        }
    }
}
