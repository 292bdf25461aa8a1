package uk.gegc.docintake.features.realtime.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import uk.gegc.docintake.features.realtime.domain.LiveMessage;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Slf4j
public class WebSocketRealtimeClient extends AbstractRealtimeClient {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final WebSocketClient webSocketClient;
    private final URI endpoint;
    private final String accessToken;
    private volatile WebSocketSession session;

    public WebSocketRealtimeClient(WebSocketClient webSocketClient, URI endpoint, String accessToken, ObjectMapper objectMapper) {
        this(webSocketClient, endpoint, accessToken, objectMapper, DEFAULT_RECONNECT_DELAY);
    }

    public WebSocketRealtimeClient(WebSocketClient webSocketClient, URI endpoint, String accessToken,
                                   ObjectMapper objectMapper, Duration reconnectDelay) {
        super(objectMapper, reconnectDelay);
        this.webSocketClient = webSocketClient;
        this.endpoint = endpoint;
        this.accessToken = accessToken;
    }

    WebSocketRealtimeClient(WebSocketClient webSocketClient, URI endpoint, String accessToken,
                            ObjectMapper objectMapper, Duration reconnectDelay, ScheduledExecutorService scheduler) {
        super(objectMapper, reconnectDelay, scheduler);
        this.webSocketClient = webSocketClient;
        this.endpoint = endpoint;
        this.accessToken = accessToken;
    }

    @Override
    protected void openTransport() throws Exception {
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        if (accessToken != null) {
            headers.setBearerAuth(accessToken);
        }
        // the handler publishes the session in afterConnectionEstablished
        WebSocketSession opened = webSocketClient.execute(new InboundHandler(), headers, endpoint)
                .get(CONNECT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        if (!opened.isOpen()) {
            throw new IOException("WebSocket session closed during handshake");
        }
    }

    @Override
    protected void closeTransport() {
        WebSocketSession current = session;
        session = null;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("Error while closing WebSocket session: {}", e.getMessage());
            }
        }
    }

    @Override
    protected void sendInvocation(LiveMessage invocation) throws IOException {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            throw new IOException("WebSocket session is not open");
        }
        String json = objectMapper.writeValueAsString(invocation);
        synchronized (current) {
            current.sendMessage(new TextMessage(json));
        }
    }

    private class InboundHandler extends TextWebSocketHandler {

        @Override
        public void afterConnectionEstablished(@NonNull WebSocketSession wsSession) {
            session = wsSession;
        }

        @Override
        protected void handleTextMessage(@NonNull WebSocketSession wsSession, @NonNull TextMessage message) {
            dispatchRaw(message.getPayload());
        }

        @Override
        public void handleTransportError(@NonNull WebSocketSession wsSession, @NonNull Throwable exception) {
            log.debug("WebSocket transport error: {}", exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(@NonNull WebSocketSession wsSession, @NonNull CloseStatus status) {
            if (wsSession == session) {
                session = null;
                onConnectionLost(new IOException("closed with " + status));
            }
        }
    }
}
