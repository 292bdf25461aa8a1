package uk.gegc.docintake.features.realtime.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import uk.gegc.docintake.features.realtime.infra.WebSocketEventChannel;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.realtime.transport", havingValue = "websocket", matchIfMissing = true)
public class WebSocketConfig implements WebSocketConfigurer {

    private final WebSocketEventChannel webSocketEventChannel;
    private final RealtimeProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(webSocketEventChannel, properties.getWebsocketPath())
                .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(String[]::new));
    }
}
