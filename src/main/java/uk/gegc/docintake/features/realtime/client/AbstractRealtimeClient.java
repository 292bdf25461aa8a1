package uk.gegc.docintake.features.realtime.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.gegc.docintake.features.realtime.domain.LiveMessage;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Handler registry, dispatch and fixed-delay reconnect shared by the transport clients.
 * Subclasses only open, close and write to their connection and report when it is lost.
 */
public abstract class AbstractRealtimeClient implements RealtimeClient {

    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofMillis(3000);

    private final Logger log = LoggerFactory.getLogger(getClass());

    protected final ObjectMapper objectMapper;
    private final Duration reconnectDelay;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Set<Consumer<JsonNode>>> handlers = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicReference<ScheduledFuture<?>> pendingReconnect = new AtomicReference<>();
    private final Object stateLock = new Object();
    private boolean opening;
    private boolean lostWhileOpening;

    protected AbstractRealtimeClient(ObjectMapper objectMapper, Duration reconnectDelay) {
        this(objectMapper, reconnectDelay, Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "realtime-reconnect");
            thread.setDaemon(true);
            return thread;
        }));
    }

    protected AbstractRealtimeClient(ObjectMapper objectMapper, Duration reconnectDelay, ScheduledExecutorService scheduler) {
        this.objectMapper = objectMapper;
        this.reconnectDelay = reconnectDelay;
        this.scheduler = scheduler;
    }

    protected abstract void openTransport() throws Exception;

    protected abstract void closeTransport();

    protected abstract void sendInvocation(LiveMessage invocation) throws IOException;

    @Override
    public void connect() {
        if (running.compareAndSet(false, true)) {
            attemptConnect();
        }
    }

    @Override
    public void disconnect() {
        running.set(false);
        ScheduledFuture<?> pending = pendingReconnect.getAndSet(null);
        if (pending != null) {
            pending.cancel(false);
        }
        if (connected.getAndSet(false)) {
            closeTransport();
        }
    }

    @Override
    public void close() {
        disconnect();
        scheduler.shutdownNow();
    }

    @Override
    public void on(String event, Consumer<JsonNode> handler) {
        handlers.computeIfAbsent(event, key -> new CopyOnWriteArraySet<>()).add(handler);
    }

    @Override
    public void off(String event, Consumer<JsonNode> handler) {
        Set<Consumer<JsonNode>> registered = handlers.get(event);
        if (registered != null) {
            registered.remove(handler);
        }
    }

    @Override
    public void invoke(String method, Object payload) {
        if (!connected.get()) {
            throw new IllegalStateException("Cannot invoke '" + method + "': not connected");
        }
        try {
            sendInvocation(new LiveMessage(method, objectMapper.valueToTree(payload)));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to send invocation '" + method + "'", e);
        }
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    /**
     * Called by subclasses when the connection ends without {@link #disconnect()} being called.
     */
    protected void onConnectionLost(Throwable cause) {
        synchronized (stateLock) {
            if (opening) {
                lostWhileOpening = true;
            }
            connected.set(false);
        }
        if (!running.get()) {
            return;
        }
        log.warn("Live connection lost{}; reconnecting in {} ms",
                cause != null ? " (" + cause.getMessage() + ")" : "", reconnectDelay.toMillis());
        scheduleReconnect();
    }

    protected void dispatchRaw(String json) {
        LiveMessage message;
        try {
            message = objectMapper.readValue(json, LiveMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding malformed live message: {}", e.getOriginalMessage());
            return;
        }
        dispatch(message);
    }

    protected void dispatch(LiveMessage message) {
        Set<Consumer<JsonNode>> registered = handlers.getOrDefault(message.type(), Set.of());
        for (Consumer<JsonNode> handler : registered) {
            try {
                handler.accept(message.payload());
            } catch (RuntimeException e) {
                log.warn("Handler for '{}' failed: {}", message.type(), e.getMessage(), e);
            }
        }
    }

    private void attemptConnect() {
        pendingReconnect.set(null);
        if (!running.get()) {
            return;
        }
        synchronized (stateLock) {
            opening = true;
            lostWhileOpening = false;
        }
        try {
            openTransport();
            synchronized (stateLock) {
                opening = false;
                // a loss reported before openTransport returned has already scheduled the reconnect
                if (lostWhileOpening) {
                    log.warn("Live connection closed while it was being established");
                    return;
                }
                connected.set(true);
            }
            log.info("Live connection established");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while connecting to live channel");
        } catch (Exception e) {
            log.warn("Live connection attempt failed: {}; retrying in {} ms", e.getMessage(), reconnectDelay.toMillis());
            scheduleReconnect();
        } finally {
            synchronized (stateLock) {
                opening = false;
            }
        }
    }

    private void scheduleReconnect() {
        if (!running.get() || scheduler.isShutdown()) {
            return;
        }
        ScheduledFuture<?> next = scheduler.schedule(this::attemptConnect, reconnectDelay.toMillis(), TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = pendingReconnect.getAndSet(next);
        if (previous != null && !previous.isDone()) {
            previous.cancel(false);
        }
    }
}
