package com.catalog.picklist.service;

import com.catalog.picklist.dto.PicklistSyncRequest;
import com.catalog.picklist.dto.PicklistSyncResult;
import com.catalog.picklist.dto.SyncRequestMetadata;
import com.catalog.picklist.model.PicklistChange;
import com.catalog.picklist.model.PicklistChange.ChangeType;
import com.catalog.picklist.model.PicklistItem;
import com.catalog.picklist.model.PicklistSyncLog;
import com.catalog.picklist.model.PicklistType;
import com.catalog.picklist.model.SyncTypeSummary;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Bulk replacement of vocabularies from an upstream system of record.
 *
 * The whole payload is validated before anything changes. Each included collection is then
 * replaced on its own: a failing collection is reported without affecting the others. Every
 * sync that passes validation leaves an audit row with the item-level diff and the
 * before-snapshot of each replaced collection.
 */
@Service
public class PicklistSyncService {

    private static final Logger logger = LoggerFactory.getLogger(PicklistSyncService.class);

    private static final TypeReference<Map<String, Object>> FLAT_ITEM = new TypeReference<>() {
    };

    private final PicklistStore store;
    private final PicklistSyncAuditService auditService;
    private final ObjectMapper objectMapper;

    public PicklistSyncService(PicklistStore store,
                               PicklistSyncAuditService auditService,
                               ObjectMapper objectMapper) {
        this.store = store;
        this.auditService = auditService;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws PicklistValidationException when the payload is invalid; nothing is applied
     */
    public PicklistSyncResult sync(PicklistSyncRequest request, SyncRequestMetadata metadata) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<String> validationErrors = validate(request);
        if (!validationErrors.isEmpty()) {
            logger.warn("Rejected picklist sync with {} validation error(s): {}", validationErrors.size(), validationErrors);
            throw new PicklistValidationException(validationErrors);
        }

        String syncId = UUID.randomUUID().toString();
        List<PicklistType> included = request.includedTypes();
        List<SyncTypeSummary> updated = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Map<String, List<PicklistChange>> changes = new LinkedHashMap<>();
        Map<String, List<Map<String, Object>>> snapshots = new LinkedHashMap<>();

        for (PicklistType type : included) {
            List<? extends PicklistItem> items = request.collection(type);
            if (items.isEmpty()) {
                logger.warn("Sync {} empties the {} collection", syncId, type.getCollectionKey());
            }
            try {
                List<PicklistItem> previous = store.replace(type, items);
                List<PicklistChange> typeChanges = new ArrayList<>();
                updated.add(diff(type, previous, items, typeChanges));
                changes.put(type.getCollectionKey(), typeChanges);
                snapshots.put(type.getCollectionKey(), previous.stream().map(this::flatten).toList());
            } catch (RuntimeException e) {
                logger.error("Sync {} failed to replace {}: {}", syncId, type.getCollectionKey(), e.getMessage(), e);
                errors.add(type.getCollectionKey() + ": " + e.getMessage());
            }
        }

        boolean success = errors.isEmpty();
        boolean partial = !success && !updated.isEmpty();
        long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
        PicklistSyncResult result = new PicklistSyncResult(syncId, success, partial, updated, errors, elapsed);
        logger.info("Sync {} finished in {} ms: success={}, partial={}, updated={}",
                syncId, elapsed, success, partial,
                updated.stream().map(s -> s.type().getCollectionKey()).toList());

        writeAudit(result, included, changes, snapshots, metadata != null ? metadata : SyncRequestMetadata.unknown());
        return result;
    }

    /**
     * Every problem in the payload, per collection. Empty when the payload can be applied.
     */
    public List<String> validate(PicklistSyncRequest request) {
        List<String> errors = new ArrayList<>();
        if (request == null || request.includedTypes().isEmpty()) {
            errors.add("At least one of brands, categories, styles or attributes is required");
            return errors;
        }
        for (PicklistType type : request.includedTypes()) {
            List<? extends PicklistItem> items = request.collection(type);
            List<String> itemErrors = new ArrayList<>();
            Set<String> seenIds = new LinkedHashSet<>();
            Set<String> duplicateIds = new LinkedHashSet<>();
            for (int i = 0; i < items.size(); i++) {
                PicklistItem item = items.get(i);
                if (item == null) {
                    itemErrors.add("item " + i + " is null");
                    continue;
                }
                List<String> missing = item.missingFields();
                if (!missing.isEmpty()) {
                    itemErrors.add("item " + i + " missing " + String.join(", ", missing));
                }
                if (item.id() != null && !item.id().isBlank() && !seenIds.add(item.id())) {
                    duplicateIds.add(item.id());
                }
            }
            if (!itemErrors.isEmpty()) {
                errors.add(type.getCollectionKey() + ": " + itemErrors.size() + " invalid item(s): "
                        + String.join("; ", itemErrors));
            }
            if (!duplicateIds.isEmpty()) {
                errors.add(type.getCollectionKey() + ": duplicate ids " + duplicateIds);
            }
        }
        return errors;
    }

    SyncTypeSummary diff(PicklistType type,
                         List<? extends PicklistItem> previous,
                         List<? extends PicklistItem> next,
                         List<PicklistChange> changes) {
        Map<String, PicklistItem> before = indexById(previous);
        Map<String, PicklistItem> after = indexById(next);

        Set<String> added = Sets.difference(after.keySet(), before.keySet());
        Set<String> removed = Sets.difference(before.keySet(), after.keySet());
        List<String> modified = Sets.intersection(after.keySet(), before.keySet()).stream()
                .filter(id -> !Objects.equals(before.get(id), after.get(id)))
                .toList();

        List<String> addedNames = new ArrayList<>();
        for (String id : added) {
            PicklistItem item = after.get(id);
            addedNames.add(item.name());
            changes.add(new PicklistChange(ChangeType.ADDED, id, item.name(), null, flatten(item)));
        }
        List<String> removedNames = new ArrayList<>();
        for (String id : removed) {
            PicklistItem item = before.get(id);
            removedNames.add(item.name());
            changes.add(new PicklistChange(ChangeType.REMOVED, id, item.name(), flatten(item), null));
        }
        for (String id : modified) {
            PicklistItem item = after.get(id);
            changes.add(new PicklistChange(ChangeType.MODIFIED, id, item.name(), flatten(before.get(id)), flatten(item)));
        }

        return new SyncTypeSummary(type, previous.size(), next.size(),
                added.size(), removed.size(), modified.size(), addedNames, removedNames);
    }

    private void writeAudit(PicklistSyncResult result,
                            List<PicklistType> included,
                            Map<String, List<PicklistChange>> changes,
                            Map<String, List<Map<String, Object>>> snapshots,
                            SyncRequestMetadata metadata) {
        PicklistSyncLog log = PicklistSyncLog.builder()
                .syncId(result.syncId())
                .sourceIp(metadata.sourceIp())
                .userAgent(metadata.userAgent())
                .requestBodySize(metadata.requestBodySize())
                .typesIncluded(included)
                .success(result.success())
                .syncErrors(result.errors())
                .summaries(result.updated())
                .detailedChanges(changes)
                .snapshots(snapshots)
                .processingTimeMs(result.processingTimeMs())
                .build();
        try {
            auditService.record(log);
        } catch (RuntimeException e) {
            logger.error("Failed to write audit log for sync {}: {}", result.syncId(), e.getMessage(), e);
        }
    }

    private static Map<String, PicklistItem> indexById(List<? extends PicklistItem> items) {
        Map<String, PicklistItem> index = new LinkedHashMap<>();
        for (PicklistItem item : items) {
            index.putIfAbsent(item.id(), item);
        }
        return index;
    }

    private Map<String, Object> flatten(PicklistItem item) {
        return objectMapper.convertValue(item, FLAT_ITEM);
    }
}
