package com.catalog.picklist.repository;

import com.catalog.picklist.dto.MismatchQuery;
import com.catalog.picklist.model.MismatchRecord;

import java.util.List;

public interface MismatchRecordRepositoryCustom {

    /**
     * One page of records matching the query, ordered by the requested property.
     */
    List<MismatchRecord> search(MismatchQuery query);

    /**
     * Number of records matching the query's filters, ignoring paging.
     */
    long countMatching(MismatchQuery query);
}
