package uk.gegc.docintake.features.realtime.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import uk.gegc.docintake.features.realtime.application.LiveEventPublisher;
import uk.gegc.docintake.features.realtime.application.LiveInvocationHandler;
import uk.gegc.docintake.features.realtime.domain.LiveMessage;

import java.io.IOException;
import java.security.Principal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raw WebSocket transport. Each connected session is wrapped in a
 * {@link ConcurrentWebSocketSessionDecorator} so concurrent publishers cannot interleave frames.
 */
@Slf4j
public class WebSocketEventChannel extends TextWebSocketHandler implements LiveEventPublisher {

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final LiveInvocationHandler invocationHandler;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public WebSocketEventChannel(ObjectMapper objectMapper,
                                 LiveInvocationHandler invocationHandler,
                                 int sendTimeLimitMs,
                                 int bufferSizeLimit) {
        this.objectMapper = objectMapper;
        this.invocationHandler = invocationHandler;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        sessions.put(session.getId(), new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit));
        log.info("Live subscriber {} connected ({} active)", describe(session), sessions.size());
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        sessions.remove(session.getId());
        log.info("Live subscriber {} disconnected with {} ({} active)", describe(session), status, sessions.size());
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        sessions.remove(session.getId());
        log.debug("Transport error for live subscriber {}: {}", describe(session), exception.getMessage());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        LiveMessage invocation;
        try {
            invocation = objectMapper.readValue(message.getPayload(), LiveMessage.class);
        } catch (JsonProcessingException e) {
            log.debug("Discarding malformed message from {}: {}", describe(session), e.getOriginalMessage());
            return;
        }

        Optional<LiveMessage> reply = invocationHandler.handle(invocation, describe(session));
        if (reply.isPresent()) {
            WebSocketSession target = sessions.getOrDefault(session.getId(), session);
            send(target, serialize(reply.get().type(), reply.get().payload()));
        }
    }

    @Override
    public void publish(String type, Object payload) {
        TextMessage frame = serialize(type, payload);
        List<WebSocketSession> snapshot = List.copyOf(sessions.values());
        for (WebSocketSession session : snapshot) {
            send(session, frame);
        }
        log.debug("Published {} to {} WebSocket subscribers", type, snapshot.size());
    }

    @Override
    public int subscriberCount() {
        return sessions.size();
    }

    private void send(WebSocketSession session, TextMessage frame) {
        if (!session.isOpen()) {
            sessions.remove(session.getId());
            return;
        }
        try {
            session.sendMessage(frame);
        } catch (IOException | RuntimeException e) {
            sessions.remove(session.getId());
            log.debug("Dropping live subscriber {} after failed send: {}", session.getId(), e.getMessage());
        }
    }

    private TextMessage serialize(String type, Object payload) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(
                    new LiveMessage(type, objectMapper.valueToTree(payload))));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize live message of type " + type, e);
        }
    }

    private static String describe(WebSocketSession session) {
        Principal principal = session.getPrincipal();
        return principal != null ? principal.getName() + "/" + session.getId() : session.getId();
    }
}
