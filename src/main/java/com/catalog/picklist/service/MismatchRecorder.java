package com.catalog.picklist.service;

import com.catalog.picklist.dto.MismatchExportRow;
import com.catalog.picklist.dto.MismatchInput;
import com.catalog.picklist.dto.MismatchPage;
import com.catalog.picklist.dto.MismatchQuery;
import com.catalog.picklist.dto.MismatchResolution;
import com.catalog.picklist.dto.MismatchStats;
import com.catalog.picklist.model.MismatchKey;
import com.catalog.picklist.model.MismatchRecord;
import com.catalog.picklist.model.PicklistType;
import com.catalog.picklist.repository.MismatchRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records unmatched values and serves the triage views over them.
 *
 * Recording only buffers; durable writes happen in {@link MismatchWriteBuffer}. Reads that
 * summarise the table flush the buffer first so recent observations are counted.
 */
@Service
public class MismatchRecorder {

    private static final Logger logger = LoggerFactory.getLogger(MismatchRecorder.class);

    static final int STATS_LIST_SIZE = 10;
    public static final int DEFAULT_EXPORT_LIMIT = 1000;

    private final MismatchWriteBuffer buffer;
    private final MismatchRecordRepository repository;
    private final double nearMissMin;
    private final double nearMissMax;

    public MismatchRecorder(MismatchWriteBuffer buffer,
                            MismatchRecordRepository repository,
                            @Value("${app.mismatch.near-miss.min-similarity:0.4}") double nearMissMin,
                            @Value("${app.mismatch.near-miss.max-similarity:0.6}") double nearMissMax) {
        this.buffer = buffer;
        this.repository = repository;
        this.nearMissMin = nearMissMin;
        this.nearMissMax = nearMissMax;
    }

    /**
     * Buffers one observation. Never throws; a failure here must not break matching.
     */
    public void record(MismatchInput input) {
        try {
            if (buffer.enqueue(input)) {
                logger.debug("Buffered mismatch {} (similarity {})", input.key(), input.similarity());
            }
        } catch (RuntimeException e) {
            logger.error("Failed to buffer mismatch {}: {}", input.key(), e.getMessage(), e);
        }
    }

    public int flush() {
        return buffer.flush();
    }

    public int pendingCount() {
        return buffer.pendingCount();
    }

    public long droppedCount() {
        return buffer.droppedCount();
    }

    @Transactional(readOnly = true)
    public MismatchPage query(MismatchQuery query) {
        List<MismatchRecord> records = repository.search(query);
        long total = repository.countMatching(query);
        return new MismatchPage(records, total, query.effectiveSkip(), query.effectiveLimit());
    }

    public MismatchStats stats() {
        flush();
        long resolved = repository.countByResolved(true);
        long unresolved = repository.countByResolved(false);

        Map<PicklistType, Long> byType = new EnumMap<>(PicklistType.class);
        for (PicklistType type : PicklistType.values()) {
            byType.put(type, 0L);
        }
        for (Object[] row : repository.countUnresolvedByType()) {
            byType.put((PicklistType) row[0], ((Number) row[1]).longValue());
        }

        Map<String, Long> bySource = new LinkedHashMap<>();
        for (Object[] row : repository.countUnresolvedBySource()) {
            bySource.put((String) row[0], ((Number) row[1]).longValue());
        }

        return new MismatchStats(
                resolved + unresolved,
                unresolved,
                resolved,
                byType,
                bySource,
                topUnresolved(null, STATS_LIST_SIZE),
                nearMisses(STATS_LIST_SIZE));
    }

    /**
     * Unresolved records whose best similarity fell just short of acceptance, most similar first.
     * These usually point at a missing alias or a typo in the vocabulary.
     */
    @Transactional(readOnly = true)
    public List<MismatchRecord> nearMisses(int limit) {
        return repository.findNearMisses(nearMissMin, nearMissMax, PageRequest.of(0, clamp(limit)));
    }

    @Transactional(readOnly = true)
    public List<MismatchRecord> topUnresolved(PicklistType type, int limit) {
        return repository.findTopUnresolved(type, PageRequest.of(0, clamp(limit)));
    }

    /**
     * Resolves the records for a type and value. With a source only that record is resolved,
     * without one every unresolved record for the value is.
     *
     * @return the affected records after the update
     * @throws MismatchNotFoundException        when no record exists for the key
     * @throws MismatchAlreadyResolvedException when every matching record is already resolved
     */
    @Transactional
    public List<MismatchRecord> resolve(PicklistType type, String value, String source, MismatchResolution resolution) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value is required");
        }
        flush();
        String normalizedValue = MismatchKey.normalizeValue(value);
        String sourceFilter = source == null || source.isBlank() ? null : source;

        List<MismatchRecord> existing = sourceFilter == null
                ? repository.findByMatchTypeAndNormalizedValue(type, normalizedValue)
                : repository.findByMatchTypeAndNormalizedValueAndSource(type, normalizedValue, sourceFilter);
        if (existing.isEmpty()) {
            throw new MismatchNotFoundException("No mismatch recorded for " + type.getWireName()
                    + " '" + value + "'" + (sourceFilter == null ? "" : " from source '" + sourceFilter + "'"));
        }

        int updated = repository.resolveUnresolved(type, normalizedValue, sourceFilter,
                resolution.action(), resolution.resolvedValue(), resolution.resolvedTo(),
                resolution.notes(), resolution.resolvedBy(), OffsetDateTime.now());
        if (updated == 0) {
            throw new MismatchAlreadyResolvedException("Mismatch for " + type.getWireName()
                    + " '" + value + "' is already resolved");
        }
        logger.info("Resolved {} mismatch record(s) for {} '{}' as {} by {}",
                updated, type.getWireName(), normalizedValue, resolution.action().getValue(), resolution.resolvedBy());

        return sourceFilter == null
                ? repository.findByMatchTypeAndNormalizedValue(type, normalizedValue)
                : repository.findByMatchTypeAndNormalizedValueAndSource(type, normalizedValue, sourceFilter);
    }

    /**
     * @return number of records that were unresolved and are now resolved
     */
    @Transactional
    public int bulkResolve(List<UUID> ids, MismatchResolution resolution) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("ids must be a non-empty array");
        }
        int updated = repository.resolveByIds(ids, resolution.action(), resolution.resolvedValue(),
                resolution.resolvedTo(), resolution.notes(), resolution.resolvedBy(), OffsetDateTime.now());
        logger.info("Bulk resolved {} of {} mismatch record(s) as {}", updated, ids.size(), resolution.action().getValue());
        return updated;
    }

    @Transactional(readOnly = true)
    public List<MismatchRecord> forProduct(String catalogId) {
        return repository.findByCatalogIdOrderByLastSeenDesc(catalogId);
    }

    @Transactional(readOnly = true)
    public List<MismatchRecord> forSession(String sessionId) {
        return repository.findBySessionIdOrderByLastSeenDesc(sessionId);
    }

    @Transactional(readOnly = true)
    public List<MismatchExportRow> export(MismatchQuery query) {
        return repository.search(query).stream().map(MismatchExportRow::from).toList();
    }

    private static int clamp(int limit) {
        if (limit <= 0) {
            return STATS_LIST_SIZE;
        }
        return Math.min(limit, MismatchQuery.MAX_LIMIT);
    }
}
