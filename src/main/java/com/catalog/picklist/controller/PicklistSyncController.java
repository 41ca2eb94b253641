package com.catalog.picklist.controller;

import com.catalog.picklist.dto.PicklistSyncRequest;
import com.catalog.picklist.dto.PicklistSyncResult;
import com.catalog.picklist.dto.SyncRequestMetadata;
import com.catalog.picklist.service.PicklistSyncAuditService;
import com.catalog.picklist.service.PicklistSyncService;
import com.catalog.picklist.service.PicklistValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

import static com.catalog.picklist.controller.PicklistController.error;

@RestController
@RequestMapping("/api/picklists/sync")
@Tag(name = "Picklist sync", description = "Bulk replacement from the system of record, with audit trail")
public class PicklistSyncController {

    private static final Logger logger = LoggerFactory.getLogger(PicklistSyncController.class);

    private final PicklistSyncService syncService;
    private final PicklistSyncAuditService auditService;

    public PicklistSyncController(PicklistSyncService syncService, PicklistSyncAuditService auditService) {
        this.syncService = syncService;
        this.auditService = auditService;
    }

    @Operation(
            summary = "Replace one or more picklists",
            description = "Each collection present in the body replaces the stored one. Collections are applied independently."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Every collection replaced"),
            @ApiResponse(responseCode = "207", description = "Some collections replaced, others failed"),
            @ApiResponse(responseCode = "400", description = "Invalid payload; nothing applied"),
            @ApiResponse(responseCode = "500", description = "No collection could be replaced")
    })
    @PostMapping
    public ResponseEntity<?> sync(@RequestBody(required = false) PicklistSyncRequest request,
                                  HttpServletRequest servletRequest) {
        try {
            PicklistSyncResult result = syncService.sync(request, metadata(servletRequest));
            return ResponseEntity.status(statusFor(result)).body(result);
        } catch (PicklistValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid sync payload", "errors", e.getErrors()));
        } catch (Exception e) {
            logger.error("Picklist sync failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "Recent sync audit entries, newest first (without snapshots)")
    @GetMapping("/logs")
    public ResponseEntity<?> logs(@RequestParam(required = false) Integer limit,
                                  @RequestParam(required = false) Boolean success) {
        try {
            return ResponseEntity.ok(auditService.recent(limit, success));
        } catch (Exception e) {
            logger.error("Failed to list sync logs: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "One sync audit entry including before-snapshots")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Audit entry found"),
            @ApiResponse(responseCode = "404", description = "Unknown sync id")
    })
    @GetMapping("/logs/{syncId}")
    public ResponseEntity<?> log(@Parameter(description = "Sync id returned by the sync call", required = true)
                                 @PathVariable String syncId) {
        return auditService.find(syncId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("Sync log '" + syncId + "' not found")));
    }

    static HttpStatus statusFor(PicklistSyncResult result) {
        if (result.success()) {
            return HttpStatus.OK;
        }
        return result.partial() ? HttpStatus.MULTI_STATUS : HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static SyncRequestMetadata metadata(HttpServletRequest request) {
        if (request == null) {
            return SyncRequestMetadata.unknown();
        }
        String forwarded = request.getHeader("X-Forwarded-For");
        String sourceIp = forwarded != null && !forwarded.isBlank()
                ? forwarded.split(",")[0].trim()
                : request.getRemoteAddr();
        return new SyncRequestMetadata(sourceIp, request.getHeader(HttpHeaders.USER_AGENT),
                Math.max(0L, request.getContentLengthLong()));
    }
}
