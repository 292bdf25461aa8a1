package uk.gegc.docintake.features.audit.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.docintake.features.audit.api.dto.AuditEventDto;
import uk.gegc.docintake.features.audit.application.AuditService;
import uk.gegc.docintake.features.auth.application.CurrentUserResolver;

@RestController
@RequestMapping("/api/v1/audit-events")
@RequiredArgsConstructor
@Tag(name = "Audit Events", description = "Read access to the audit log")
@SecurityRequirement(name = "Bearer Authentication")
public class AuditEventController {

    private final AuditService auditService;
    private final CurrentUserResolver currentUserResolver;

    @Operation(
            summary = "List audit events",
            description = "Administrators receive every event; other users receive only their own. Newest first."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Events returned"),
            @ApiResponse(responseCode = "401", description = "Not authenticated")
    })
    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Page<AuditEventDto>> list(
            @Parameter(hidden = true) Authentication authentication,
            @ParameterObject @PageableDefault(size = 50) Pageable pageable
    ) {
        return ResponseEntity.ok(auditService.query(currentUserResolver.resolve(authentication), pageable));
    }
}
