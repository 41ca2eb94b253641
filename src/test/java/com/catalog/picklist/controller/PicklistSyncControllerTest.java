package com.catalog.picklist.controller;

import com.catalog.picklist.dto.PicklistSyncRequest;
import com.catalog.picklist.dto.PicklistSyncResult;
import com.catalog.picklist.dto.SyncRequestMetadata;
import com.catalog.picklist.service.PicklistSyncAuditService;
import com.catalog.picklist.service.PicklistSyncService;
import com.catalog.picklist.service.PicklistValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PicklistSyncControllerTest {

    @Mock
    private PicklistSyncService syncService;

    @Mock
    private PicklistSyncAuditService auditService;

    @Mock
    private HttpServletRequest servletRequest;

    private PicklistSyncController controller;

    @BeforeEach
    void setUp() {
        controller = new PicklistSyncController(syncService, auditService);
    }

    @Test
    void statusReflectsOutcome() {
        assertThat(PicklistSyncController.statusFor(result(true, false))).isEqualTo(HttpStatus.OK);
        assertThat(PicklistSyncController.statusFor(result(false, true))).isEqualTo(HttpStatus.MULTI_STATUS);
        assertThat(PicklistSyncController.statusFor(result(false, false))).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void partialSyncReturnsMultiStatusAndForwardedClient() {
        when(servletRequest.getHeader("X-Forwarded-For")).thenReturn("203.0.113.7, 10.0.0.1");
        when(servletRequest.getHeader(HttpHeaders.USER_AGENT)).thenReturn("pim-sync/2.1");
        when(servletRequest.getContentLengthLong()).thenReturn(2048L);
        PicklistSyncRequest request = new PicklistSyncRequest();
        PicklistSyncResult partial = result(false, true);
        when(syncService.sync(eq(request), any(SyncRequestMetadata.class))).thenReturn(partial);

        ResponseEntity<?> response = controller.sync(request, servletRequest);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.MULTI_STATUS);
        assertThat(response.getBody()).isSameAs(partial);
        ArgumentCaptor<SyncRequestMetadata> metadata = ArgumentCaptor.forClass(SyncRequestMetadata.class);
        verify(syncService).sync(eq(request), metadata.capture());
        assertThat(metadata.getValue()).isEqualTo(new SyncRequestMetadata("203.0.113.7", "pim-sync/2.1", 2048L));
    }

    @Test
    void invalidPayloadIsBadRequestWithEveryError() {
        List<String> errors = List.of("brands: 1 invalid item(s): item 0 missing brand_name", "styles: duplicate ids [s1]");
        when(syncService.sync(any(), any())).thenThrow(new PicklistValidationException(errors));

        ResponseEntity<?> response = controller.sync(new PicklistSyncRequest(), null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isInstanceOfSatisfying(Map.class,
                body -> assertThat(body.get("errors")).isEqualTo(errors));
    }

    @Test
    void unknownSyncLogIsNotFound() {
        when(auditService.find("missing")).thenReturn(Optional.empty());

        ResponseEntity<?> response = controller.log("missing");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    private static PicklistSyncResult result(boolean success, boolean partial) {
        return new PicklistSyncResult("sync-1", success, partial, List.of(), List.of(), 5L);
    }
}
