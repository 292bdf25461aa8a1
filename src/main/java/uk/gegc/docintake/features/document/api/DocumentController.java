package uk.gegc.docintake.features.document.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.docintake.features.auth.application.CurrentUserResolver;
import uk.gegc.docintake.features.document.api.dto.DocumentDto;
import uk.gegc.docintake.features.document.api.dto.UploadDocumentResponse;
import uk.gegc.docintake.features.document.application.DocumentDownload;
import uk.gegc.docintake.features.document.application.DocumentIngestionService;
import uk.gegc.docintake.features.document.application.IngestionResult;
import uk.gegc.docintake.features.document.domain.model.ProcessHint;
import uk.gegc.docintake.features.document.infra.mapping.DocumentMapper;
import uk.gegc.docintake.shared.security.CallerIdentity;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/documents")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Documents", description = "Upload, processing, download and deletion of documents")
@SecurityRequirement(name = "Bearer Authentication")
@PreAuthorize("isAuthenticated()")
public class DocumentController {

    private final DocumentIngestionService documentIngestionService;
    private final DocumentMapper documentMapper;
    private final CurrentUserResolver currentUserResolver;

    @Operation(
            summary = "Upload a document",
            description = "Stores the file. With process=BulkImport a CSV is imported as users (admins only); " +
                    "with process=Analyze the document is classified and its data extracted."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "201",
                    description = "Document stored",
                    content = @Content(schema = @Schema(implementation = UploadDocumentResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Empty or unreadable file"),
            @ApiResponse(responseCode = "403", description = "Bulk import requested by a non-admin"),
            @ApiResponse(responseCode = "413", description = "File exceeds the upload limit")
    })
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadDocumentResponse> upload(
            @Parameter(description = "File to upload", required = true) @RequestParam("file") MultipartFile file,
            @Parameter(description = "Processing path: BulkImport or Analyze") @RequestParam(value = "process", required = false) String process,
            @Parameter(hidden = true) Authentication authentication) {

        CallerIdentity caller = currentUserResolver.resolve(authentication);
        ProcessHint hint = ProcessHint.fromToken(process).orElse(null);
        log.debug("Upload of {} by {} with process hint {}", file.getOriginalFilename(), caller.username(), hint);

        IngestionResult result = documentIngestionService.ingest(
                file, file.getOriginalFilename(), file.getContentType(), caller, hint);

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new UploadDocumentResponse(documentMapper.toDto(result.document()), result.importErrors()));
    }

    @Operation(summary = "List my documents", description = "Documents owned by the caller, newest first")
    @GetMapping
    public ResponseEntity<Page<DocumentDto>> listMine(
            @Parameter(hidden = true) Authentication authentication,
            @ParameterObject @PageableDefault(size = 20) Pageable pageable) {
        CallerIdentity caller = currentUserResolver.resolve(authentication);
        return ResponseEntity.ok(documentIngestionService.listMine(caller, pageable).map(documentMapper::toDto));
    }

    @Operation(summary = "Get document metadata")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Document returned"),
            @ApiResponse(responseCode = "403", description = "Not the owner"),
            @ApiResponse(responseCode = "404", description = "Document not found")
    })
    @GetMapping("/{documentId}")
    public ResponseEntity<DocumentDto> getDocument(
            @PathVariable UUID documentId,
            @Parameter(hidden = true) Authentication authentication) {
        CallerIdentity caller = currentUserResolver.resolve(authentication);
        return ResponseEntity.ok(documentMapper.toDto(documentIngestionService.getDocument(documentId, caller)));
    }

    @Operation(summary = "Download document bytes")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "File content"),
            @ApiResponse(responseCode = "403", description = "Not the owner"),
            @ApiResponse(responseCode = "404", description = "Document or stored bytes not found")
    })
    @GetMapping("/{documentId}/download")
    public ResponseEntity<byte[]> download(
            @PathVariable UUID documentId,
            @Parameter(hidden = true) Authentication authentication) {
        CallerIdentity caller = currentUserResolver.resolve(authentication);
        DocumentDownload download = documentIngestionService.download(documentId, caller);

        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(download.fileName(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(download.mediaType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentLength(download.content().length)
                .body(download.content());
    }

    @Operation(summary = "Delete a document", description = "Removes the record and its stored bytes")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted"),
            @ApiResponse(responseCode = "403", description = "Not the owner"),
            @ApiResponse(responseCode = "404", description = "Document not found")
    })
    @DeleteMapping("/{documentId}")
    public ResponseEntity<Void> delete(
            @PathVariable UUID documentId,
            @Parameter(hidden = true) Authentication authentication) {
        CallerIdentity caller = currentUserResolver.resolve(authentication);
        documentIngestionService.delete(documentId, caller);
        return ResponseEntity.noContent().build();
    }
}
