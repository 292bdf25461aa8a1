package uk.gegc.docintake.features.realtime.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.docintake.features.realtime.domain.LiveEventTypes;
import uk.gegc.docintake.features.realtime.domain.LiveMessage;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Handles messages sent by live clients. Only {@code Ping} is understood; it is answered with {@code Pong}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiveInvocationHandler {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Optional<LiveMessage> handle(LiveMessage invocation, String subscriber) {
        if (invocation == null || invocation.type() == null) {
            log.debug("Ignoring empty invocation from {}", subscriber);
            return Optional.empty();
        }
        if (LiveEventTypes.PING.equals(invocation.type())) {
            return Optional.of(new LiveMessage(LiveEventTypes.PONG,
                    objectMapper.valueToTree(Map.of("timestamp", Instant.now(clock).toString()))));
        }
        log.debug("Ignoring unsupported invocation '{}' from {}", invocation.type(), subscriber);
        return Optional.empty();
    }
}
