package com.planningpoker.service;

import com.planningpoker.protocol.PokerMessage;
import com.planningpoker.protocol.PokerMessage.CreateSessionRequest;
import com.planningpoker.protocol.PokerMessage.JoinSessionRequest;
import com.planningpoker.protocol.PokerMessage.TopicChangeRequest;
import com.planningpoker.protocol.PokerMessage.VoteRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Single-threaded front door to the {@link SessionRegistry}.
 *
 * Every call is queued on one executor thread and runs to completion before the next,
 * so registry state never needs locking. The same thread runs the {@link SessionSweeper}.
 */
public class SessionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);

    private final SessionRegistry registry;
    private final SessionSweeper sweeper;
    private final Duration sweepInterval;
    private final ScheduledExecutorService mailbox = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "session-coordinator");
        thread.setDaemon(true);
        return thread;
    });

    public SessionCoordinator(SessionRegistry registry, Clock clock, Duration sweepInterval) {
        this.registry = registry;
        this.sweeper = new SessionSweeper(registry, clock);
        this.sweepInterval = sweepInterval;
    }

    /**
     * Coordinator with the system clock, random ids and median outcomes.
     */
    public static SessionCoordinator create(Duration evictionWindow, Duration sweepInterval) {
        Clock clock = Clock.systemUTC();
        SessionRegistry registry = new SessionRegistry(clock, RandomIds::next, new MedianOutcomePolicy(), evictionWindow);
        return new SessionCoordinator(registry, clock, sweepInterval);
    }

    public void start() {
        long periodMillis = sweepInterval.toMillis();
        mailbox.scheduleAtFixedRate(() -> runSafely("sweep", sweeper), periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("Session coordinator started, sweeping every {}ms (eviction window {}s)",
                periodMillis, registry.evictionWindow().toSeconds());
    }

    /**
     * Registers an outbound channel and returns the participant id assigned to it.
     * The registration is queued ahead of anything the caller dispatches afterwards.
     */
    public String connect(ParticipantChannel channel) {
        String participantId = RandomIds.next();
        enqueue("connect", () -> registry.connect(participantId, channel));
        return participantId;
    }

    /**
     * Queues a client request.
     *
     * @param participantId id assigned by {@link #connect}, never one read from the wire
     * @param sessionId     session the connection is in, or null
     */
    public void dispatch(String participantId, String sessionId, PokerMessage request) {
        dispatch(participantId, () -> sessionId, request);
    }

    /**
     * Queues a client request whose session id is resolved on the coordinator thread,
     * so a create or join queued just before it is already applied.
     */
    public void dispatch(String participantId, Supplier<String> sessionId, PokerMessage request) {
        enqueue(request.type().wireName(), () -> handle(participantId, sessionId.get(), request));
    }

    public void disconnect(String participantId, String sessionId) {
        disconnect(participantId, () -> sessionId);
    }

    /**
     * Queues a disconnect whose session id is resolved on the coordinator thread,
     * after every request the connection queued before it.
     */
    public void disconnect(String participantId, Supplier<String> sessionId) {
        enqueue("disconnect", () -> registry.disconnect(participantId, sessionId.get()));
    }

    /**
     * Runs a read-only query on the coordinator thread.
     */
    public <T> CompletableFuture<T> query(Function<SessionRegistry, T> query) {
        CompletableFuture<T> result = new CompletableFuture<>();
        enqueue("query", () -> {
            try {
                result.complete(query.apply(registry));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Closes every connection and stops the coordinator thread.
     */
    public void shutdown() {
        enqueue("shutdown", registry::closeAll);
        mailbox.shutdown();
        try {
            if (!mailbox.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Coordinator did not drain within 5s, forcing shutdown");
                mailbox.shutdownNow();
            }
        } catch (InterruptedException e) {
            mailbox.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Session coordinator stopped");
    }

    private void handle(String participantId, String sessionId, PokerMessage request) {
        if (!registry.isConnected(participantId)) {
            log.debug("Dropping {} from unknown participant {}", request, participantId);
            return;
        }
        switch (request.type()) {
            case CREATE_SESSION_REQUEST:
                registry.createSession(participantId, ((CreateSessionRequest) request).participantName);
                break;
            case JOIN_SESSION_REQUEST: {
                JoinSessionRequest join = (JoinSessionRequest) request;
                registry.joinSession(join.sessionId, participantId, join.participantName);
                break;
            }
            case TOPIC_CHANGE_REQUEST:
                registry.changeTopic(sessionId, participantId, ((TopicChangeRequest) request).topicRef);
                break;
            case VOTE_REQUEST: {
                VoteRequest vote = (VoteRequest) request;
                registry.castVote(sessionId, vote.issueId, participantId, vote.vote);
                break;
            }
            case SESSION_INFO_RESPONSE:
            case SESSION_JOIN_ERROR_RESPONSE:
            case PARTICIPANT_JOIN_ANNOUNCEMENT:
            case PARTICIPANT_LEAVE_ANNOUNCEMENT:
            case VOTING_ISSUE_ANNOUNCEMENT:
            case VOTE_RECEIPT_ANNOUNCEMENT:
            case VOTING_RESULTS_REVELATION:
                log.warn("Ignoring server-only message {} sent by participant {}", request, participantId);
                break;
            default:
                throw new IllegalArgumentException("Unhandled message type " + request.type());
        }
    }

    private void enqueue(String operation, Runnable task) {
        try {
            mailbox.execute(() -> runSafely(operation, task));
        } catch (RejectedExecutionException e) {
            log.debug("Coordinator stopped, dropping {}", operation);
        }
    }

    private static void runSafely(String operation, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Coordinator operation {} failed", operation, e);
        }
    }
}
