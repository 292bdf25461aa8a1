package uk.gegc.docintake.features.realtime.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.docintake.features.realtime.domain.LiveMessage;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbstractRealtimeClientTest {

    /**
     * In-memory transport: counts opens, records invocations and can fail the first N opens.
     */
    static class FakeClient extends AbstractRealtimeClient {
        final AtomicInteger opens = new AtomicInteger();
        final AtomicInteger closes = new AtomicInteger();
        final List<LiveMessage> sent = new CopyOnWriteArrayList<>();
        final AtomicInteger failuresLeft = new AtomicInteger();
        final AtomicInteger dropsWhileOpening = new AtomicInteger();
        volatile CountDownLatch openLatch = new CountDownLatch(1);

        FakeClient(Duration reconnectDelay) {
            super(new ObjectMapper(), reconnectDelay);
        }

        @Override
        protected void openTransport() throws Exception {
            opens.incrementAndGet();
            if (failuresLeft.getAndDecrement() > 0) {
                openLatch.countDown();
                throw new IOException("connection refused");
            }
            if (dropsWhileOpening.getAndDecrement() > 0) {
                onConnectionLost(new IOException("closed during handshake"));
            }
            openLatch.countDown();
        }

        @Override
        protected void closeTransport() {
            closes.incrementAndGet();
        }

        @Override
        protected void sendInvocation(LiveMessage invocation) {
            sent.add(invocation);
        }

        void receive(String json) {
            dispatchRaw(json);
        }

        void drop() {
            onConnectionLost(new IOException("reset by peer"));
        }
    }

    private FakeClient client;

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    @Test
    @DisplayName("registering the same handler twice still delivers each message once")
    void on_sameHandlerTwice_deliversOnce() {
        client = new FakeClient(Duration.ofMillis(20));
        List<JsonNode> received = new CopyOnWriteArrayList<>();
        Consumer<JsonNode> handler = received::add;

        client.on("ReceiveLog", handler);
        client.on("ReceiveLog", handler);
        client.receive("{\"type\":\"ReceiveLog\",\"payload\":{\"eventType\":\"Document Upload\"}}");

        assertThat(received).hasSize(1);
        assertThat(received.get(0).get("eventType").asText()).isEqualTo("Document Upload");
    }

    @Test
    void off_stopsDelivery_andOtherTypesAreIgnored() {
        client = new FakeClient(Duration.ofMillis(20));
        List<JsonNode> received = new CopyOnWriteArrayList<>();
        Consumer<JsonNode> handler = received::add;
        client.on("ReceiveLog", handler);

        client.receive("{\"type\":\"Pong\",\"payload\":{}}");
        client.off("ReceiveLog", handler);
        client.receive("{\"type\":\"ReceiveLog\",\"payload\":{}}");
        client.receive("garbage");

        assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("a failing handler does not stop the others")
    void dispatch_handlerFailure_isIsolated() {
        client = new FakeClient(Duration.ofMillis(20));
        AtomicInteger calls = new AtomicInteger();
        client.on("ReceiveLog", payload -> {
            throw new IllegalStateException("boom");
        });
        client.on("ReceiveLog", payload -> calls.incrementAndGet());

        client.receive("{\"type\":\"ReceiveLog\",\"payload\":{}}");

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void invoke_whenDisconnected_throws() {
        client = new FakeClient(Duration.ofMillis(20));

        assertThatThrownBy(() -> client.invoke("Ping", null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not connected");
    }

    @Test
    void invoke_whenConnected_sendsEnvelope() {
        client = new FakeClient(Duration.ofMillis(20));
        client.connect();

        client.invoke("Ping", Map.of());

        assertThat(client.isConnected()).isTrue();
        assertThat(client.sent).extracting(LiveMessage::type).containsExactly("Ping");
    }

    @Test
    @DisplayName("a lost connection is re-established after the delay")
    void connectionLost_reconnects() throws Exception {
        client = new FakeClient(Duration.ofMillis(20));
        client.connect();
        assertThat(client.opens.get()).isEqualTo(1);

        client.openLatch = new CountDownLatch(1);
        client.drop();

        assertThat(client.isConnected()).isFalse();
        assertThat(client.openLatch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(client.opens.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("failed connection attempts are retried until one succeeds")
    void connect_retriesAfterFailure() throws Exception {
        client = new FakeClient(Duration.ofMillis(20));
        client.failuresLeft.set(2);
        CountDownLatch thirdAttempt = new CountDownLatch(3);
        client.openLatch = thirdAttempt;

        client.connect();

        assertThat(thirdAttempt.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(client.opens.get()).isGreaterThanOrEqualTo(3);
    }

    @Test
    @DisplayName("a connection lost before opening completes is retried instead of reported as connected")
    void lostWhileOpening_isNotConnected_andReconnects() throws Exception {
        client = new FakeClient(Duration.ofMillis(200));
        client.dropsWhileOpening.set(1);
        CountDownLatch secondAttempt = new CountDownLatch(2);
        client.openLatch = secondAttempt;

        client.connect();
        boolean connectedAfterFirstAttempt = client.isConnected();

        assertThat(secondAttempt.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(connectedAfterFirstAttempt).isFalse();
        assertThat(client.opens.get()).isGreaterThanOrEqualTo(2);
    }

    @Test
    @DisplayName("after disconnect a lost connection is not retried")
    void disconnect_stopsReconnects() throws Exception {
        client = new FakeClient(Duration.ofMillis(20));
        client.connect();

        client.disconnect();
        client.drop();
        Thread.sleep(100);

        assertThat(client.opens.get()).isEqualTo(1);
        assertThat(client.closes.get()).isEqualTo(1);
        assertThat(client.isConnected()).isFalse();
    }
}
