package com.autoresearch.stream;

import com.autoresearch.research.model.Stage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

@Component
public class ResearchStreamHub {
    private static final Logger log = LoggerFactory.getLogger(ResearchStreamHub.class);
    static final String RUN_ID_ATTRIBUTE = "runId";
    private static final int MAX_BUFFER_SIZE = 500;
    private static final long CLEANUP_TTL_MS = 30 * 60 * 1000L;

    private final ObjectMapper objectMapper;
    private final Map<String, StreamRun> runs = new ConcurrentHashMap<>();

    public ResearchStreamHub(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String createRun() {
        cleanupExpiredRuns();
        String runId = UUID.randomUUID().toString();
        runs.put(runId, new StreamRun(runId));
        return runId;
    }

    public boolean exists(String runId) {
        return runs.containsKey(runId);
    }

    public void registerSession(String runId, WebSocketSession session, long sinceId) throws IOException {
        StreamRun run = runs.get(runId);
        if (run == null) {
            session.close();
            return;
        }
        cleanupExpiredRuns();
        run.sessions().put(session.getId(), session);
        session.getAttributes().put(RUN_ID_ATTRIBUTE, runId);
        for (StreamEvent event : run.snapshotSince(sinceId)) {
            send(session, event);
        }
    }

    public void removeSession(WebSocketSession session) {
        Object runIdObj = session.getAttributes().get(RUN_ID_ATTRIBUTE);
        if (runIdObj == null) {
            return;
        }
        String runId = runIdObj.toString();
        StreamRun run = runs.get(runId);
        if (run == null) {
            return;
        }
        run.sessions().remove(session.getId());
        pruneIfComplete(run);
    }

    public void emit(String runId, String type, Stage stage, String message, Object data) {
        StreamRun run = runs.get(runId);
        if (run == null || run.completed()) {
            return;
        }
        StreamEvent event = run.addEvent(type, stage, message, data, MAX_BUFFER_SIZE);
        run.sessions().values().forEach(session -> send(session, event));
        if (event.isTerminal()) {
            run.markCompleted();
            pruneIfComplete(run);
        }
    }

    public boolean cancelRun(String runId) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            return false;
        }
        if (run.cancelled() || run.completed()) {
            return true;
        }
        run.markCancelled();
        StreamEvent event = run.addEvent(StreamEvent.TYPE_RUN_CANCEL, null, "Cancellation requested", Map.of(),
                MAX_BUFFER_SIZE);
        run.sessions().values().forEach(session -> send(session, event));
        return true;
    }

    public boolean isCancelled(String runId) {
        StreamRun run = runs.get(runId);
        return run != null && run.cancelled();
    }

    /**
     * A lazy, finite sequence of the run's events from its start, ending after the terminal event. Each run's
     * sequence can be taken once.
     *
     * @throws IllegalArgumentException for an unknown run
     * @throws IllegalStateException    when the sequence was already taken
     */
    public Stream<StreamEvent> stream(String runId) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            throw new IllegalArgumentException("Unknown run " + runId);
        }
        if (!run.claimConsumer()) {
            throw new IllegalStateException("Events of run " + runId + " were already consumed");
        }
        Iterator<StreamEvent> iterator = new Iterator<>() {
            private StreamEvent next;
            private boolean finished;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                if (finished) {
                    return false;
                }
                try {
                    next = run.consumerQueue().take();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    finished = true;
                    return false;
                }
                return true;
            }

            @Override
            public StreamEvent next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                StreamEvent event = next;
                next = null;
                if (event.isTerminal()) {
                    finished = true;
                }
                return event;
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator,
                Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private void send(WebSocketSession session, StreamEvent event) {
        if (!session.isOpen()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(event);
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (IOException ex) {
            log.debug("Failed to send stream event: {}", ex.getMessage());
        }
    }

    private void pruneIfComplete(StreamRun run) {
        if (!run.completed() || !run.sessions().isEmpty()) {
            return;
        }
        long cutoff = System.currentTimeMillis() - CLEANUP_TTL_MS;
        if (run.lastUpdated().toEpochMilli() < cutoff) {
            runs.remove(run.runId());
        }
    }

    private void cleanupExpiredRuns() {
        long cutoff = System.currentTimeMillis() - CLEANUP_TTL_MS;
        runs.values().removeIf(run -> run.completed()
                && run.sessions().isEmpty()
                && run.lastUpdated().toEpochMilli() < cutoff);
    }
}
