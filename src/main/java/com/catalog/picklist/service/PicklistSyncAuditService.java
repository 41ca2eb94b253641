package com.catalog.picklist.service;

import com.catalog.picklist.dto.SyncLogSummary;
import com.catalog.picklist.model.PicklistSyncLog;
import com.catalog.picklist.repository.PicklistSyncLogRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Append-only audit trail of bulk syncs in {@code picklist_sync_logs}.
 */
@Service
public class PicklistSyncAuditService {

    static final int DEFAULT_LOG_LIMIT = 50;
    static final int MAX_LOG_LIMIT = 500;

    private final PicklistSyncLogRepository repository;

    public PicklistSyncAuditService(PicklistSyncLogRepository repository) {
        this.repository = repository;
    }

    /**
     * Persists in its own transaction so the sync outcome never depends on the audit write.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(PicklistSyncLog log) {
        repository.saveAndFlush(log);
    }

    /**
     * Newest first, without snapshots.
     */
    @Transactional(readOnly = true)
    public List<SyncLogSummary> recent(Integer limit, Boolean success) {
        int size = limit == null || limit <= 0 ? DEFAULT_LOG_LIMIT : Math.min(limit, MAX_LOG_LIMIT);
        PageRequest page = PageRequest.of(0, size);
        List<PicklistSyncLog> logs = success == null
                ? repository.findAllByOrderByTimestampDesc(page)
                : repository.findBySuccessOrderByTimestampDesc(success, page);
        return logs.stream().map(SyncLogSummary::from).toList();
    }

    @Transactional(readOnly = true)
    public Optional<PicklistSyncLog> find(String syncId) {
        return repository.findById(syncId);
    }
}
