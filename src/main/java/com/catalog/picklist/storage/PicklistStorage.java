package com.catalog.picklist.storage;

import com.catalog.picklist.model.PicklistItem;
import com.catalog.picklist.model.PicklistType;

import java.util.List;

/**
 * Durable home of the four vocabularies. Implementations replace a whole collection at a time
 * and either persist all of it or none of it.
 *
 * Both methods throw {@link com.catalog.picklist.service.PicklistPersistenceException} on failure.
 */
public interface PicklistStorage {

    List<PicklistItem> load(PicklistType type);

    void save(PicklistType type, List<? extends PicklistItem> items);
}
