package com.autoresearch.stream;

import com.autoresearch.research.service.ResearchEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * Live progress of one research run at {@code /ws/research?runId=...&since=...}. Events with an id above
 * {@code since} are replayed on connect, so a client that lost its connection resumes where it stopped. The only
 * message a client may send is {@code cancel}.
 */
@Slf4j
@Component
public class ResearchStreamWebSocketHandler extends TextWebSocketHandler {

    static final CloseStatus MISSING_RUN_ID = CloseStatus.BAD_DATA.withReason("runId is required");
    static final CloseStatus UNKNOWN_RUN = new CloseStatus(4404, "Unknown run");
    static final String CANCEL_COMMAND = "cancel";

    private final ResearchStreamHub hub;
    private final ResearchEngine researchEngine;

    public ResearchStreamWebSocketHandler(ResearchStreamHub hub, ResearchEngine researchEngine) {
        this.hub = hub;
        this.researchEngine = researchEngine;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        URI uri = session.getUri();
        MultiValueMap<String, String> params = uri == null
                ? null
                : UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        String runId = params == null ? null : decoded(params.getFirst("runId"));
        if (!StringUtils.hasText(runId)) {
            session.close(MISSING_RUN_ID);
            return;
        }
        if (!researchEngine.exists(runId)) {
            log.debug("Rejecting stream session {} for unknown run {}.", session.getId(), runId);
            session.close(UNKNOWN_RUN);
            return;
        }
        long since = replayFrom(decoded(params.getFirst("since")));
        hub.registerSession(runId, session, since);
        log.debug("Stream session {} attached to run {} from event {}.", session.getId(), runId, since);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Object runId = session.getAttributes().get(ResearchStreamHub.RUN_ID_ATTRIBUTE);
        if (runId == null) {
            return;
        }
        if (CANCEL_COMMAND.equalsIgnoreCase(message.getPayload().trim())) {
            boolean cancelled = researchEngine.cancel(runId.toString());
            log.info("Cancel requested over stream session {} for run {} (accepted={}).", session.getId(), runId,
                    cancelled);
        } else {
            log.debug("Ignoring message on stream session {}: {}", session.getId(), message.getPayload());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.removeSession(session);
    }

    /**
     * Anything but a non-negative event id replays the whole run.
     */
    static long replayFrom(String since) {
        if (!StringUtils.hasText(since)) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(since.trim()));
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }

    private static String decoded(String value) {
        return value == null ? null : UriUtils.decode(value, StandardCharsets.UTF_8);
    }
}
