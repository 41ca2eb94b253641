package com.catalog.picklist.service;

import com.catalog.picklist.dto.MatchContext;
import com.catalog.picklist.dto.MismatchInput;
import com.catalog.picklist.dto.PicklistStats;
import com.catalog.picklist.matching.MatchResult;
import com.catalog.picklist.matching.PicklistMatcher;
import com.catalog.picklist.model.PicklistType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;

/**
 * Entry point for matching: runs the matcher on the current snapshot and records genuine misses.
 */
@Service
public class PicklistMatchService {

    private static final Logger logger = LoggerFactory.getLogger(PicklistMatchService.class);

    private final PicklistStore store;
    private final PicklistMatcher matcher;
    private final MismatchRecorder recorder;

    public PicklistMatchService(PicklistStore store, PicklistMatcher matcher, MismatchRecorder recorder) {
        this.store = store;
        this.matcher = matcher;
        this.recorder = recorder;
    }

    public MatchResult match(PicklistType type, String candidate, MatchContext context) {
        MatchContext effective = context != null ? context : MatchContext.of(null);
        MatchResult result = matcher.match(type, candidate, store.get(type));
        if (result.isRecordable()) {
            logger.warn("No {} match for '{}' (best similarity {}, source {})",
                    type.getWireName(), candidate, String.format("%.3f", result.similarity()), effective.source());
            recordMismatch(type, candidate, result, effective);
        }
        return result;
    }

    public PicklistStats stats() {
        return new PicklistStats(store.counts(), recorder.pendingCount(), store.isInitialized());
    }

    public PicklistStats reload() {
        store.load();
        return stats();
    }

    private void recordMismatch(PicklistType type, String candidate, MatchResult result, MatchContext context) {
        try {
            recorder.record(new MismatchInput(
                    type,
                    candidate,
                    context.source(),
                    context.fieldKey(),
                    result.similarity(),
                    matcher.thresholdFor(type),
                    result.closestMatches(),
                    context.productContext(),
                    context.aiContext(),
                    context.rawDataContext(),
                    OffsetDateTime.now()));
        } catch (RuntimeException e) {
            logger.error("Failed to record {} mismatch '{}': {}", type.getWireName(), candidate, e.getMessage(), e);
        }
    }
}
