package uk.gegc.docintake.features.realtime.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import uk.gegc.docintake.features.realtime.domain.LiveMessage;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

/**
 * SSE transport: a long-lived GET on {@code /api/v1/live/events} for inbound messages and a
 * POST to {@code /api/v1/live/invoke} for invocations, whose reply is dispatched like any event.
 */
@Slf4j
public class SseRealtimeClient extends AbstractRealtimeClient {

    static final String EVENTS_PATH = "/api/v1/live/events";
    static final String INVOKE_PATH = "/api/v1/live/invoke";

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration INVOKE_TIMEOUT = Duration.ofSeconds(30);
    private static final ParameterizedTypeReference<ServerSentEvent<String>> EVENT_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private volatile Object currentStream;
    private volatile Disposable subscription;

    public SseRealtimeClient(WebClient.Builder webClientBuilder, URI baseUri, String accessToken, ObjectMapper objectMapper) {
        this(webClientBuilder, baseUri, accessToken, objectMapper, DEFAULT_RECONNECT_DELAY);
    }

    public SseRealtimeClient(WebClient.Builder webClientBuilder, URI baseUri, String accessToken,
                             ObjectMapper objectMapper, Duration reconnectDelay) {
        super(objectMapper, reconnectDelay);
        this.webClient = buildClient(webClientBuilder, baseUri, accessToken);
    }

    SseRealtimeClient(WebClient.Builder webClientBuilder, URI baseUri, String accessToken,
                      ObjectMapper objectMapper, Duration reconnectDelay, ScheduledExecutorService scheduler) {
        super(objectMapper, reconnectDelay, scheduler);
        this.webClient = buildClient(webClientBuilder, baseUri, accessToken);
    }

    private static WebClient buildClient(WebClient.Builder builder, URI baseUri, String accessToken) {
        return builder.clone()
                .baseUrl(baseUri.toString())
                .defaultHeaders(headers -> {
                    if (accessToken != null) {
                        headers.setBearerAuth(accessToken);
                    }
                })
                .build();
    }

    /**
     * Waits for the response headers so that a refused subscription fails the attempt,
     * then consumes the event stream in the background.
     */
    @Override
    protected void openTransport() throws Exception {
        ResponseEntity<Flux<ServerSentEvent<String>>> response;
        try {
            response = webClient.get()
                    .uri(EVENTS_PATH)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .retrieve()
                    .toEntityFlux(EVENT_TYPE)
                    .block(CONNECT_TIMEOUT);
        } catch (WebClientException e) {
            throw new IOException("SSE subscription failed: " + e.getMessage(), e);
        }
        if (response == null || response.getBody() == null) {
            throw new IOException("SSE subscription returned no event stream");
        }

        Object stream = new Object();
        currentStream = stream;
        subscription = response.getBody()
                .mapNotNull(ServerSentEvent::data)
                .subscribe(this::dispatchRaw,
                        error -> streamEnded(stream, error),
                        () -> streamEnded(stream, null));
    }

    @Override
    protected void closeTransport() {
        currentStream = null;
        Disposable current = subscription;
        subscription = null;
        if (current != null) {
            current.dispose();
        }
    }

    @Override
    protected void sendInvocation(LiveMessage invocation) throws IOException {
        String reply;
        try {
            reply = webClient.post()
                    .uri(INVOKE_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(objectMapper.writeValueAsString(invocation))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(INVOKE_TIMEOUT);
        } catch (WebClientException e) {
            throw new IOException("Invocation '" + invocation.type() + "' failed: " + e.getMessage(), e);
        }
        if (reply != null && !reply.isBlank()) {
            dispatchRaw(reply);
        }
    }

    private void streamEnded(Object stream, Throwable failure) {
        if (currentStream != stream) {
            return;
        }
        currentStream = null;
        subscription = null;
        log.debug("SSE stream ended{}", failure != null ? ": " + failure.getMessage() : "");
        onConnectionLost(failure != null ? failure : new IOException("event stream closed by server"));
    }
}
