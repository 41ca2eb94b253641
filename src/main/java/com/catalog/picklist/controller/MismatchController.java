package com.catalog.picklist.controller;

import com.catalog.picklist.dto.BulkResolveRequest;
import com.catalog.picklist.dto.MismatchQuery;
import com.catalog.picklist.dto.MismatchResolution;
import com.catalog.picklist.dto.ResolveMismatchRequest;
import com.catalog.picklist.model.MismatchRecord;
import com.catalog.picklist.model.PicklistType;
import com.catalog.picklist.service.MismatchAlreadyResolvedException;
import com.catalog.picklist.service.MismatchNotFoundException;
import com.catalog.picklist.service.MismatchRecorder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static com.catalog.picklist.controller.PicklistController.error;

@RestController
@RequestMapping("/api/mismatches")
@Tag(name = "Mismatches", description = "Triage of values that did not match any picklist entry")
public class MismatchController {

    private static final Logger logger = LoggerFactory.getLogger(MismatchController.class);

    private final MismatchRecorder recorder;

    public MismatchController(MismatchRecorder recorder) {
        this.recorder = recorder;
    }

    @Operation(summary = "Filtered, sorted page of mismatch records")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Page returned with total count"),
            @ApiResponse(responseCode = "400", description = "Unknown picklist type")
    })
    @GetMapping
    public ResponseEntity<?> query(
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) Boolean resolved,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) Long minOccurrences,
            @RequestParam(required = false) Double minSimilarity,
            @RequestParam(required = false) Double maxSimilarity,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime lastSeenFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime lastSeenTo,
            @RequestParam(required = false) Integer skip,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder) {
        try {
            MismatchQuery query = MismatchQuery.builder()
                    .type(type == null || type.isBlank() ? null : PicklistType.fromValue(type))
                    .source(source)
                    .resolved(resolved)
                    .category(category)
                    .minOccurrences(minOccurrences)
                    .minSimilarity(minSimilarity)
                    .maxSimilarity(maxSimilarity)
                    .lastSeenFrom(lastSeenFrom)
                    .lastSeenTo(lastSeenTo)
                    .skip(skip)
                    .limit(limit)
                    .sortBy(sortBy)
                    .sortOrder(sortOrder)
                    .build();
            return ResponseEntity.ok(recorder.query(query));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Failed to query mismatches: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "Totals, per-type and per-source counts, top unresolved and near misses")
    @GetMapping("/stats")
    public ResponseEntity<?> stats() {
        try {
            return ResponseEntity.ok(recorder.stats());
        } catch (Exception e) {
            logger.error("Failed to compute mismatch stats: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "Unresolved values that came close to matching")
    @GetMapping("/near-misses")
    public ResponseEntity<?> nearMisses(@RequestParam(defaultValue = "50") int limit) {
        try {
            return ResponseEntity.ok(recorder.nearMisses(limit));
        } catch (Exception e) {
            logger.error("Failed to load near misses: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "Most frequent unresolved values, optionally for one type")
    @GetMapping("/top-unresolved")
    public ResponseEntity<?> topUnresolved(@RequestParam(required = false) String type,
                                           @RequestParam(defaultValue = "20") int limit) {
        try {
            PicklistType picklistType = type == null || type.isBlank() ? null : PicklistType.fromValue(type);
            return ResponseEntity.ok(recorder.topUnresolved(picklistType, limit));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Failed to load top unresolved mismatches: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "Flat rows for offline analysis")
    @GetMapping("/export")
    public ResponseEntity<?> export(@RequestParam(required = false) String type,
                                    @RequestParam(required = false) Boolean resolved,
                                    @RequestParam(defaultValue = "" + MismatchRecorder.DEFAULT_EXPORT_LIMIT) int limit) {
        try {
            MismatchQuery query = MismatchQuery.builder()
                    .type(type == null || type.isBlank() ? null : PicklistType.fromValue(type))
                    .resolved(resolved)
                    .limit(limit)
                    .build();
            return ResponseEntity.ok(recorder.export(query));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Failed to export mismatches: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "Mismatches recorded for one product")
    @GetMapping("/product/{catalogId}")
    public ResponseEntity<?> forProduct(@PathVariable String catalogId) {
        return ResponseEntity.ok(recorder.forProduct(catalogId));
    }

    @Operation(summary = "Mismatches recorded during one enrichment session")
    @GetMapping("/session/{sessionId}")
    public ResponseEntity<?> forSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(recorder.forSession(sessionId));
    }

    @Operation(
            summary = "Resolve a mismatch by type and value",
            description = "Without a source every unresolved record for the value is resolved."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Records resolved"),
            @ApiResponse(responseCode = "400", description = "Missing or unknown action, or unknown type"),
            @ApiResponse(responseCode = "404", description = "No mismatch recorded for the value"),
            @ApiResponse(responseCode = "409", description = "Mismatch already resolved"),
            @ApiResponse(responseCode = "500", description = "Unexpected server error")
    })
    @PostMapping("/{type}/{value}/resolve")
    public ResponseEntity<?> resolve(
            @PathVariable String type,
            @Parameter(description = "Attempted value as recorded (any case or spacing)", required = true)
            @PathVariable String value,
            @RequestBody(required = false) ResolveMismatchRequest request) {
        try {
            PicklistType picklistType = PicklistType.fromValue(type);
            ResolveMismatchRequest body = request != null ? request : new ResolveMismatchRequest();
            MismatchResolution resolution = body.toResolution();
            List<MismatchRecord> records = recorder.resolve(picklistType, value, body.getSource(), resolution);
            return ResponseEntity.ok(records);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (MismatchNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(e.getMessage()));
        } catch (MismatchAlreadyResolvedException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Failed to resolve {} mismatch '{}': {}", type, value, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "Resolve many mismatch records by id")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Number of records resolved"),
            @ApiResponse(responseCode = "400", description = "Missing ids or invalid action")
    })
    @PostMapping("/resolve")
    public ResponseEntity<?> bulkResolve(@RequestBody(required = false) BulkResolveRequest request) {
        try {
            if (request == null) {
                return ResponseEntity.badRequest().body(error("ids must be a non-empty array"));
            }
            int resolvedCount = recorder.bulkResolve(request.getIds(), request.toResolution());
            return ResponseEntity.ok(Map.of("resolvedCount", resolvedCount));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Failed to bulk resolve mismatches: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "Write buffered mismatches now")
    @PostMapping("/flush")
    public ResponseEntity<?> flush() {
        try {
            return ResponseEntity.ok(Map.of("flushed", recorder.flush(),
                    "pending", recorder.pendingCount(),
                    "dropped", recorder.droppedCount()));
        } catch (Exception e) {
            logger.error("Failed to flush mismatch buffer: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }
}
