package com.catalog.picklist.service;

import com.catalog.picklist.dto.MismatchInput;
import com.catalog.picklist.dto.ProductContext;
import com.catalog.picklist.model.MismatchKey;
import com.catalog.picklist.repository.MismatchRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Writes one buffered observation per transaction.
 *
 * Uses REQUIRES_NEW so each observation commits on its own: a failure rolls back only that
 * item and the caller knows exactly which items are durable.
 */
@Service
public class MismatchUpsertStore {

    private static final Logger logger = LoggerFactory.getLogger(MismatchUpsertStore.class);

    private final MismatchRecordRepository repository;
    private final ObjectMapper objectMapper;

    public MismatchUpsertStore(MismatchRecordRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void upsert(MismatchInput input) {
        MismatchKey key = input.key();
        ProductContext product = input.productContext();
        OffsetDateTime seenAt = input.seenAt() != null ? input.seenAt() : OffsetDateTime.now();
        repository.upsert(
                UUID.randomUUID(),
                key.type().name(),
                input.attemptedValue(),
                key.normalizedValue(),
                key.source(),
                input.fieldKey(),
                input.similarity(),
                input.threshold(),
                toJson(input.closestMatches()),
                seenAt,
                product == null ? null : product.catalogId(),
                product == null ? null : product.catalogName(),
                product == null ? null : product.modelNumber(),
                product == null ? null : product.brand(),
                product == null ? null : product.category(),
                product == null ? null : product.sessionId(),
                toJson(input.aiContext()),
                toJson(input.rawDataContext()));
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize mismatch context; storing without it: {}", e.getMessage());
            return null;
        }
    }
}
