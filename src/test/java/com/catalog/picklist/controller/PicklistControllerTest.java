package com.catalog.picklist.controller;

import com.catalog.picklist.dto.MatchContext;
import com.catalog.picklist.dto.MatchRequest;
import com.catalog.picklist.matching.MatchKind;
import com.catalog.picklist.matching.MatchResult;
import com.catalog.picklist.model.Brand;
import com.catalog.picklist.model.PicklistType;
import com.catalog.picklist.service.PicklistConflictException;
import com.catalog.picklist.service.PicklistMatchService;
import com.catalog.picklist.service.PicklistStore;
import com.catalog.picklist.service.PicklistValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PicklistControllerTest {

    @Mock
    private PicklistStore store;

    @Mock
    private PicklistMatchService matchService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private PicklistController controller;

    @BeforeEach
    void setUp() {
        controller = new PicklistController(store, matchService, objectMapper);
    }

    @Test
    void matchWithoutValueIsRejected() {
        ResponseEntity<?> response = controller.match("brand", new MatchRequest());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isEqualTo(Map.of("error", "value is required"));
        verifyNoInteractions(matchService);
    }

    @Test
    void matchPassesContextToService() {
        MatchRequest request = new MatchRequest();
        request.setValue("Kohler");
        request.setSource("enrichment");
        request.setFieldKey("brand");
        MatchResult result = new MatchResult(PicklistType.BRAND, "Kohler", true, MatchKind.EXACT,
                new Brand("b1", "KOHLER"), 1.0, List.of(), "kohler", false, List.of());
        when(matchService.match(eq(PicklistType.BRAND), eq("Kohler"), any(MatchContext.class))).thenReturn(result);

        ResponseEntity<?> response = controller.match("Brands", request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isSameAs(result);
        ArgumentCaptor<MatchContext> context = ArgumentCaptor.forClass(MatchContext.class);
        verify(matchService).match(eq(PicklistType.BRAND), eq("Kohler"), context.capture());
        assertThat(context.getValue().source()).isEqualTo("enrichment");
        assertThat(context.getValue().fieldKey()).isEqualTo("brand");
    }

    @Test
    void unknownTypeIsBadRequest() {
        ResponseEntity<?> response = controller.list("colors");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).asString().contains("Unknown picklist type 'colors'");
    }

    @Test
    void missingEntryIsNotFound() {
        when(store.findById(PicklistType.STYLE, "s404")).thenReturn(Optional.empty());

        ResponseEntity<?> response = controller.findById("style", "s404");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isEqualTo(Map.of("error", "style 's404' not found"));
    }

    @Test
    void addedEntryIsCreated() {
        ObjectNode body = objectMapper.createObjectNode()
                .put("brand_id", "b9")
                .put("brand_name", "Blanco");
        Brand stored = new Brand("b9", "BLANCO");
        when(store.add(PicklistType.BRAND, new Brand("b9", "Blanco"))).thenReturn(stored);

        ResponseEntity<?> response = controller.add("brand", body);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody()).isEqualTo(stored);
    }

    @Test
    void conflictingEntryReturnsExisting() {
        ObjectNode body = objectMapper.createObjectNode()
                .put("brand_id", "b9")
                .put("brand_name", "kohler");
        Brand existing = new Brand("b1", "KOHLER");
        when(store.add(any(), any())).thenThrow(new PicklistConflictException("brand named 'KOHLER' already exists", existing));

        ResponseEntity<?> response = controller.add("brand", body);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isInstanceOfSatisfying(Map.class, conflict -> {
            assertThat(conflict.get("error")).isEqualTo("brand named 'KOHLER' already exists");
            assertThat(conflict.get("existing")).isEqualTo(existing);
        });
    }

    @Test
    void entryWithMissingFieldsIsBadRequest() {
        ObjectNode body = objectMapper.createObjectNode().put("style_id", "s9");
        when(store.add(any(), any())).thenThrow(new PicklistValidationException(List.of("Missing required fields: style_name")));

        ResponseEntity<?> response = controller.add("style", body);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }
}
