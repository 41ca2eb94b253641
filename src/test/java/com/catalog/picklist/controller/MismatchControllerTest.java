package com.catalog.picklist.controller;

import com.catalog.picklist.dto.BulkResolveRequest;
import com.catalog.picklist.dto.MismatchResolution;
import com.catalog.picklist.dto.ResolveMismatchRequest;
import com.catalog.picklist.model.PicklistType;
import com.catalog.picklist.model.ResolutionAction;
import com.catalog.picklist.service.MismatchAlreadyResolvedException;
import com.catalog.picklist.service.MismatchNotFoundException;
import com.catalog.picklist.service.MismatchRecorder;
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
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MismatchControllerTest {

    @Mock
    private MismatchRecorder recorder;

    private MismatchController controller;

    @BeforeEach
    void setUp() {
        controller = new MismatchController(recorder);
    }

    @Test
    void resolveWithoutActionIsBadRequest() {
        ResponseEntity<?> response = controller.resolve("brand", "Kohlr", new ResolveMismatchRequest());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verifyNoInteractions(recorder);
    }

    @Test
    void resolveUnknownValueIsNotFound() {
        when(recorder.resolve(eq(PicklistType.BRAND), eq("Kohlr"), isNull(), any()))
                .thenThrow(new MismatchNotFoundException("No brand mismatch recorded for 'kohlr'"));

        ResponseEntity<?> response = controller.resolve("brand", "Kohlr", request("ignored"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void resolveAlreadyResolvedIsConflict() {
        when(recorder.resolve(any(), any(), any(), any()))
                .thenThrow(new MismatchAlreadyResolvedException("brand mismatch 'kohlr' is already resolved"));

        ResponseEntity<?> response = controller.resolve("brand", "Kohlr", request("mapped_to_existing"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void resolvePassesSourceAndResolution() {
        ResolveMismatchRequest request = request("mapped_to_existing");
        request.setResolvedTo("b1");
        request.setSource("enrichment");
        when(recorder.resolve(any(), any(), any(), any())).thenReturn(List.of());

        ResponseEntity<?> response = controller.resolve("brands", "Kohlr", request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        ArgumentCaptor<MismatchResolution> resolution = ArgumentCaptor.forClass(MismatchResolution.class);
        verify(recorder).resolve(eq(PicklistType.BRAND), eq("Kohlr"), eq("enrichment"), resolution.capture());
        assertThat(resolution.getValue().action()).isEqualTo(ResolutionAction.MAPPED_TO_EXISTING);
        assertThat(resolution.getValue().resolvedTo()).isEqualTo("b1");
        assertThat(resolution.getValue().resolvedBy()).isEqualTo(MismatchResolution.DEFAULT_RESOLVED_BY);
    }

    @Test
    void bulkResolveReportsCount() {
        BulkResolveRequest request = new BulkResolveRequest();
        request.setIds(List.of(UUID.randomUUID(), UUID.randomUUID()));
        request.setAction("ignored");
        when(recorder.bulkResolve(eq(request.getIds()), any())).thenReturn(2);

        ResponseEntity<?> response = controller.bulkResolve(request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(Map.of("resolvedCount", 2));
    }

    @Test
    void bulkResolveWithoutIdsIsBadRequest() {
        BulkResolveRequest request = new BulkResolveRequest();
        request.setAction("ignored");
        when(recorder.bulkResolve(isNull(), any())).thenThrow(new IllegalArgumentException("ids must be a non-empty array"));

        ResponseEntity<?> response = controller.bulkResolve(request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void unknownTypeFilterIsBadRequest() {
        ResponseEntity<?> response = controller.topUnresolved("colour", 20);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    private static ResolveMismatchRequest request(String action) {
        ResolveMismatchRequest request = new ResolveMismatchRequest();
        request.setAction(action);
        return request;
    }
}
