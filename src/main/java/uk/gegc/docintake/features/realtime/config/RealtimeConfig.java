package uk.gegc.docintake.features.realtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.docintake.features.realtime.application.LiveInvocationHandler;
import uk.gegc.docintake.features.realtime.infra.SseEventChannel;
import uk.gegc.docintake.features.realtime.infra.WebSocketEventChannel;

/**
 * Selects the live transport from {@code app.realtime.transport}. The selected channel is the
 * only {@link uk.gegc.docintake.features.realtime.application.LiveEventPublisher} in the context.
 *
 * <ul>
 *     <li>websocket: raw WebSocket endpoint (default)</li>
 *     <li>sse: Server-Sent Events stream plus an HTTP invoke endpoint</li>
 * </ul>
 */
@Slf4j
@Configuration
public class RealtimeConfig {

    @Bean
    @ConditionalOnProperty(name = "app.realtime.transport", havingValue = "websocket", matchIfMissing = true)
    public WebSocketEventChannel webSocketEventChannel(ObjectMapper objectMapper,
                                                       LiveInvocationHandler invocationHandler,
                                                       RealtimeProperties properties) {
        log.info("Activating WebSocket live transport at {}", properties.getWebsocketPath());
        return new WebSocketEventChannel(objectMapper, invocationHandler,
                properties.getSendTimeLimitMs(), properties.getSendBufferSizeLimit());
    }

    @Bean
    @ConditionalOnProperty(name = "app.realtime.transport", havingValue = "sse")
    public SseEventChannel sseEventChannel(ObjectMapper objectMapper, RealtimeProperties properties) {
        log.info("Activating SSE live transport (timeout {})", properties.getSseTimeout());
        return new SseEventChannel(objectMapper, properties.getSseTimeout());
    }
}
