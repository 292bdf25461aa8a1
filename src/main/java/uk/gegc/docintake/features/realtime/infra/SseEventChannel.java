package uk.gegc.docintake.features.realtime.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import uk.gegc.docintake.features.realtime.application.LiveEventPublisher;
import uk.gegc.docintake.features.realtime.domain.LiveMessage;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Server-Sent Events transport. The SSE event name is the message type and the data is the
 * full {@code {type, payload}} envelope, so clients of either transport parse the same JSON.
 */
@Slf4j
public class SseEventChannel implements LiveEventPublisher {

    private final Set<SseEmitter> emitters = new CopyOnWriteArraySet<>();
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public SseEventChannel(ObjectMapper objectMapper, Duration timeout) {
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    public SseEmitter subscribe(String subscriber) {
        SseEmitter emitter = createEmitter(timeout.toMillis());
        emitters.add(emitter);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> {
            emitters.remove(emitter);
            emitter.complete();
        });
        emitter.onError(error -> emitters.remove(emitter));

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException | IllegalStateException e) {
            emitters.remove(emitter);
            log.debug("SSE subscriber {} went away during handshake: {}", subscriber, e.getMessage());
            return emitter;
        }
        log.info("SSE subscriber {} connected ({} active)", subscriber, emitters.size());
        return emitter;
    }

    protected SseEmitter createEmitter(long timeoutMillis) {
        return new SseEmitter(timeoutMillis);
    }

    @Override
    public void publish(String type, Object payload) {
        LiveMessage message = new LiveMessage(type, objectMapper.valueToTree(payload));
        List<SseEmitter> snapshot = List.copyOf(emitters);
        for (SseEmitter emitter : snapshot) {
            try {
                emitter.send(SseEmitter.event().name(type).data(message, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                emitters.remove(emitter);
                log.debug("Dropping SSE subscriber after failed send: {}", e.getMessage());
            }
        }
        log.debug("Published {} to {} SSE subscribers", type, snapshot.size());
    }

    @Override
    public int subscriberCount() {
        return emitters.size();
    }
}
