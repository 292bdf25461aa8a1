package uk.gegc.docintake.features.realtime.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;
import uk.gegc.docintake.features.realtime.domain.LiveMessage;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class LiveInvocationHandlerTest {

    private final LiveInvocationHandler handler = new LiveInvocationHandler(new ObjectMapper(),
            Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC));

    @Test
    void ping_returnsPongWithTimestamp() {
        Optional<LiveMessage> reply = handler.handle(new LiveMessage("Ping", JsonNodeFactory.instance.objectNode()), "alice");

        assertThat(reply).isPresent();
        assertThat(reply.get().type()).isEqualTo("Pong");
        assertThat(reply.get().payload().get("timestamp").asText()).isEqualTo("2024-01-01T12:00:00Z");
    }

    @Test
    void unknownInvocation_returnsEmpty() {
        assertThat(handler.handle(new LiveMessage("Subscribe", null), "alice")).isEmpty();
        assertThat(handler.handle(null, "alice")).isEmpty();
    }
}
