package com.catalog.picklist.service;

import com.catalog.picklist.model.PicklistItem;
import com.catalog.picklist.model.PicklistType;
import com.catalog.picklist.storage.PicklistStorage;
import com.google.common.collect.ImmutableList;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory authority for the four vocabularies.
 *
 * Each collection is an immutable snapshot behind an {@link AtomicReference}: readers never
 * block and always see a whole collection. Writers of the same collection are serialized by a
 * per-type lock, and every write persists before the snapshot is swapped, so memory never runs
 * ahead of durable storage.
 */
@Service
public class PicklistStore {

    private static final Logger logger = LoggerFactory.getLogger(PicklistStore.class);

    private final PicklistStorage storage;
    private final Map<PicklistType, AtomicReference<ImmutableList<PicklistItem>>> snapshots =
            new EnumMap<>(PicklistType.class);
    private final Map<PicklistType, ReentrantLock> locks = new EnumMap<>(PicklistType.class);
    private volatile boolean initialized;

    public PicklistStore(PicklistStorage storage) {
        this.storage = storage;
        for (PicklistType type : PicklistType.values()) {
            snapshots.put(type, new AtomicReference<>(ImmutableList.of()));
            locks.put(type, new ReentrantLock());
        }
    }

    @PostConstruct
    public void initialize() {
        load();
    }

    /**
     * Loads every collection from storage. A collection that fails to load keeps its current
     * snapshot (empty before the first successful load) and the store reports itself as not
     * initialized.
     *
     * @return true when all four collections loaded
     */
    public boolean load() {
        boolean allLoaded = true;
        for (PicklistType type : PicklistType.values()) {
            ReentrantLock lock = locks.get(type);
            lock.lock();
            try {
                List<PicklistItem> items = storage.load(type);
                snapshots.get(type).set(ImmutableList.copyOf(items));
            } catch (RuntimeException e) {
                allLoaded = false;
                logger.error("Failed to load {}; keeping {} entries in memory: {}",
                        type.getCollectionKey(), get(type).size(), e.getMessage(), e);
            } finally {
                lock.unlock();
            }
        }
        initialized = allLoaded;
        logger.info("Picklists loaded: {} (initialized={})", counts(), allLoaded);
        return allLoaded;
    }

    public ImmutableList<PicklistItem> get(PicklistType type) {
        return snapshots.get(type).get();
    }

    public Optional<PicklistItem> findById(PicklistType type, String id) {
        if (id == null) {
            return Optional.empty();
        }
        return get(type).stream().filter(item -> id.equals(item.id())).findFirst();
    }

    /**
     * Persists {@code items} as the whole collection, then swaps it in.
     *
     * @return the snapshot that was replaced
     * @throws PicklistPersistenceException when storage rejects the write; memory is unchanged
     */
    public ImmutableList<PicklistItem> replace(PicklistType type, List<? extends PicklistItem> items) {
        ReentrantLock lock = locks.get(type);
        lock.lock();
        try {
            ImmutableList<PicklistItem> previous = get(type);
            ImmutableList<PicklistItem> next = ImmutableList.copyOf(items);
            storage.save(type, next);
            snapshots.get(type).set(next);
            logger.info("Replaced {}: {} -> {} entries", type.getCollectionKey(), previous.size(), next.size());
            return previous;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends one entry. Brand names are stored upper-case.
     *
     * @return the entry as stored
     * @throws PicklistValidationException  when required fields are missing
     * @throws PicklistConflictException    when the id or the name (ignoring case) already exists
     * @throws PicklistPersistenceException when storage rejects the write
     */
    public PicklistItem add(PicklistType type, PicklistItem item) {
        if (item == null) {
            throw new PicklistValidationException(List.of(type.getWireName() + " body is required"));
        }
        List<String> missing = item.missingFields();
        if (!missing.isEmpty()) {
            throw new PicklistValidationException(List.of("Missing required fields: " + String.join(", ", missing)));
        }
        PicklistItem toStore = type == PicklistType.BRAND
                ? item.withName(item.name().trim().toUpperCase(Locale.ROOT))
                : item;

        ReentrantLock lock = locks.get(type);
        lock.lock();
        try {
            ImmutableList<PicklistItem> current = get(type);
            for (PicklistItem existing : current) {
                if (toStore.id().equals(existing.id())) {
                    throw new PicklistConflictException(
                            type.getWireName() + " with id '" + toStore.id() + "' already exists", existing);
                }
                if (existing.name() != null && toStore.name().trim().equalsIgnoreCase(existing.name().trim())) {
                    throw new PicklistConflictException(
                            type.getWireName() + " named '" + existing.name() + "' already exists", existing);
                }
            }
            ImmutableList<PicklistItem> next = ImmutableList.<PicklistItem>builder()
                    .addAll(current)
                    .add(toStore)
                    .build();
            storage.save(type, next);
            snapshots.get(type).set(next);
            logger.info("Added {} '{}' ({})", type.getWireName(), toStore.name(), toStore.id());
            return toStore;
        } finally {
            lock.unlock();
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Entry counts keyed by collection key, in type order.
     */
    public Map<String, Integer> counts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (PicklistType type : PicklistType.values()) {
            counts.put(type.getCollectionKey(), get(type).size());
        }
        return counts;
    }
}
