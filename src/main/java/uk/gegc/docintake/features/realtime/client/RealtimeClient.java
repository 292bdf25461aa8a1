package uk.gegc.docintake.features.realtime.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.function.Consumer;

/**
 * Client of the live event channel, independent of the transport behind it.
 *
 * <p>Implementations reconnect on their own after an unexpected disconnect and keep the
 * registered handlers across reconnects. Registering the same handler twice for an event
 * has no further effect: each message is delivered to it once.</p>
 */
public interface RealtimeClient extends AutoCloseable {

    void connect();

    void disconnect();

    void on(String event, Consumer<JsonNode> handler);

    void off(String event, Consumer<JsonNode> handler);

    /**
     * Sends an invocation to the server. Any reply arrives as a regular event.
     *
     * @throws IllegalStateException if the client is not currently connected
     */
    void invoke(String method, Object payload);

    boolean isConnected();

    @Override
    default void close() {
        disconnect();
    }
}
