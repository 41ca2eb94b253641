package com.catalog.picklist.storage;

import com.catalog.picklist.model.PicklistEntry;
import com.catalog.picklist.model.PicklistItem;
import com.catalog.picklist.model.PicklistType;
import com.catalog.picklist.repository.PicklistEntryRepository;
import com.catalog.picklist.service.PicklistPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Vocabulary rows in {@code picklist_entries}. A save deletes and re-inserts the whole type in
 * one transaction, so a failed save rolls back to the previous collection.
 */
@Component
@ConditionalOnProperty(name = "app.picklist.storage.mode", havingValue = "database")
public class DatabasePicklistStorage implements PicklistStorage {

    private static final Logger logger = LoggerFactory.getLogger(DatabasePicklistStorage.class);

    private final PicklistEntryRepository entryRepository;

    public DatabasePicklistStorage(PicklistEntryRepository entryRepository) {
        this.entryRepository = entryRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<PicklistItem> load(PicklistType type) {
        try {
            List<PicklistItem> items = new ArrayList<>();
            for (PicklistEntry entry : entryRepository.findAllByPicklistTypeOrderByPositionAsc(type)) {
                items.add(entry.toItem());
            }
            logger.info("Loaded {} {} from database", items.size(), type.getCollectionKey());
            return items;
        } catch (DataAccessException e) {
            throw new PicklistPersistenceException("Failed to load " + type.getCollectionKey() + " from database", e);
        }
    }

    @Override
    @Transactional
    public void save(PicklistType type, List<? extends PicklistItem> items) {
        try {
            int removed = entryRepository.deleteAllOfType(type);
            List<PicklistEntry> entries = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                entries.add(PicklistEntry.from(type, items.get(i), i));
            }
            entryRepository.saveAll(entries);
            entryRepository.flush();
            logger.debug("Replaced {} rows with {} for {}", removed, entries.size(), type.getCollectionKey());
        } catch (DataAccessException e) {
            throw new PicklistPersistenceException("Failed to save " + type.getCollectionKey() + " to database", e);
        }
    }
}
