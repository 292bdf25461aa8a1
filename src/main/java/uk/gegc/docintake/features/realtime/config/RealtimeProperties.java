package uk.gegc.docintake.features.realtime.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "app.realtime")
public class RealtimeProperties {

    public enum Transport {
        WEBSOCKET,
        SSE
    }

    /**
     * Push mechanism for live audit events. Exactly one is active.
     */
    @NotNull
    private Transport transport = Transport.WEBSOCKET;

    @NotBlank
    private String websocketPath = "/ws/events";

    /**
     * Origins allowed to open the WebSocket endpoint.
     */
    private List<String> allowedOrigins = List.of("*");

    /**
     * Lifetime of one SSE subscription; clients reconnect after it elapses.
     */
    @NotNull
    private Duration sseTimeout = Duration.ofMinutes(30);

    /**
     * Per-session send limits for WebSocket subscribers. A slow subscriber exceeding them is dropped.
     */
    private int sendTimeLimitMs = 10_000;

    private int sendBufferSizeLimit = 512 * 1024;
}
