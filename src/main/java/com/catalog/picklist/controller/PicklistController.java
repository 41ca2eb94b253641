package com.catalog.picklist.controller;

import com.catalog.picklist.dto.MatchRequest;
import com.catalog.picklist.matching.MatchResult;
import com.catalog.picklist.model.PicklistItem;
import com.catalog.picklist.model.PicklistType;
import com.catalog.picklist.service.PicklistConflictException;
import com.catalog.picklist.service.PicklistMatchService;
import com.catalog.picklist.service.PicklistStore;
import com.catalog.picklist.service.PicklistValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/picklists")
@Tag(name = "Picklists", description = "Read, match and extend the governed vocabularies")
public class PicklistController {

    private static final Logger logger = LoggerFactory.getLogger(PicklistController.class);

    private final PicklistStore store;
    private final PicklistMatchService matchService;
    private final ObjectMapper objectMapper;

    public PicklistController(PicklistStore store, PicklistMatchService matchService, ObjectMapper objectMapper) {
        this.store = store;
        this.matchService = matchService;
        this.objectMapper = objectMapper;
    }

    @Operation(summary = "Vocabulary sizes, buffered mismatches and load state")
    @GetMapping("/stats")
    public ResponseEntity<?> stats() {
        return ResponseEntity.ok(matchService.stats());
    }

    @Operation(summary = "Full collection for one picklist type")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Collection returned"),
            @ApiResponse(responseCode = "400", description = "Unknown picklist type")
    })
    @GetMapping("/{type}")
    public ResponseEntity<?> list(
            @Parameter(description = "brand, category, style or attribute (singular or plural)", required = true)
            @PathVariable String type) {
        try {
            return ResponseEntity.ok(store.get(PicklistType.fromValue(type)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        }
    }

    @Operation(summary = "One picklist entry by id")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Entry found"),
            @ApiResponse(responseCode = "400", description = "Unknown picklist type"),
            @ApiResponse(responseCode = "404", description = "No entry with that id")
    })
    @GetMapping("/{type}/{id}")
    public ResponseEntity<?> findById(@PathVariable String type, @PathVariable String id) {
        try {
            PicklistType picklistType = PicklistType.fromValue(type);
            return store.findById(picklistType, id)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(error(picklistType.getWireName() + " '" + id + "' not found")));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        }
    }

    @Operation(
            summary = "Match a free-text value against a picklist",
            description = "Returns the best entry with its similarity. Unmatched values are recorded for review."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Match result (matched or not)"),
            @ApiResponse(responseCode = "400", description = "Missing value or unknown type"),
            @ApiResponse(responseCode = "500", description = "Unexpected server error")
    })
    @PostMapping("/match/{type}")
    public ResponseEntity<?> match(@PathVariable String type, @RequestBody(required = false) MatchRequest request) {
        try {
            PicklistType picklistType = PicklistType.fromValue(type);
            if (request == null || request.getValue() == null || request.getValue().isBlank()) {
                return ResponseEntity.badRequest().body(error("value is required"));
            }
            MatchResult result = matchService.match(picklistType, request.getValue(), request.toContext());
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Failed to match {} value: {}", type, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "Add one entry to a picklist")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Entry added"),
            @ApiResponse(responseCode = "400", description = "Missing required fields or unknown type"),
            @ApiResponse(responseCode = "409", description = "An entry with the same id or name exists"),
            @ApiResponse(responseCode = "500", description = "Entry could not be persisted")
    })
    @PostMapping("/{type}")
    public ResponseEntity<?> add(@PathVariable String type, @RequestBody(required = false) JsonNode body) {
        try {
            PicklistType picklistType = PicklistType.fromValue(type);
            PicklistItem item = body == null || body.isNull()
                    ? null
                    : objectMapper.treeToValue(body, picklistType.getItemClass());
            PicklistItem stored = store.add(picklistType, item);
            return ResponseEntity.status(HttpStatus.CREATED).body(stored);
        } catch (PicklistConflictException e) {
            Map<String, Object> conflict = new LinkedHashMap<>();
            conflict.put("error", e.getMessage());
            conflict.put("existing", e.getExisting());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(conflict);
        } catch (PicklistValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "errors", e.getErrors()));
        } catch (IllegalArgumentException | JsonProcessingException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Failed to add {} entry: {}", type, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "Reload every picklist from storage")
    @PostMapping("/reload")
    public ResponseEntity<?> reload() {
        try {
            return ResponseEntity.ok(matchService.reload());
        } catch (Exception e) {
            logger.error("Failed to reload picklists: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    static Map<String, String> error(String message) {
        return Map.of("error", message == null ? "Unexpected error" : message);
    }
}
