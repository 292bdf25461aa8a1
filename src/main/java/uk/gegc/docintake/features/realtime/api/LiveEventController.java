package uk.gegc.docintake.features.realtime.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import uk.gegc.docintake.features.realtime.application.LiveInvocationHandler;
import uk.gegc.docintake.features.realtime.domain.LiveMessage;
import uk.gegc.docintake.features.realtime.infra.SseEventChannel;

/**
 * HTTP side of the SSE transport. Only registered when {@code app.realtime.transport=sse}.
 */
@RestController
@RequestMapping("/api/v1/live")
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.realtime.transport", havingValue = "sse")
@Tag(name = "Live Events", description = "Server-Sent Events stream of audit events")
@SecurityRequirement(name = "Bearer Authentication")
public class LiveEventController {

    private final SseEventChannel sseEventChannel;
    private final LiveInvocationHandler invocationHandler;

    @Operation(summary = "Subscribe to live events",
            description = "Streams every appended audit event as an SSE event named after the message type (ReceiveLog).")
    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe(@Parameter(hidden = true) Authentication authentication) {
        return sseEventChannel.subscribe(authentication.getName());
    }

    @Operation(summary = "Invoke a server method", description = "Returns the reply message, or 204 when there is none.")
    @PostMapping(path = "/invoke", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LiveMessage> invoke(@RequestBody LiveMessage invocation,
                                              @Parameter(hidden = true) Authentication authentication) {
        return invocationHandler.handle(invocation, authentication.getName())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
