package com.catalog.picklist.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Audit trail entry for one bulk picklist sync. Written once, never updated.
 * The before-snapshots allow a manual rollback of any collection the sync replaced.
 * Changes and snapshots are keyed by collection key ("brands", "categories", ...).
 */
@Entity
@Table(name = "picklist_sync_logs", indexes = {
        @Index(name = "idx_picklist_sync_logs_timestamp", columnList = "synced_at"),
        @Index(name = "idx_picklist_sync_logs_success", columnList = "success, synced_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PicklistSyncLog {

    @Id
    @Column(name = "sync_id", updatable = false, nullable = false)
    private String syncId;

    @Column(name = "synced_at", nullable = false, updatable = false)
    private OffsetDateTime timestamp;

    @Column(name = "source_ip")
    private String sourceIp;

    @Column(name = "user_agent", columnDefinition = "TEXT")
    private String userAgent;

    @Column(name = "request_body_size")
    private long requestBodySize;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "types_included")
    private List<PicklistType> typesIncluded;

    @Column(name = "success", nullable = false)
    private boolean success;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "sync_errors")
    private List<String> syncErrors;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "summaries")
    private List<SyncTypeSummary> summaries;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "detailed_changes")
    private Map<String, List<PicklistChange>> detailedChanges;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "snapshots")
    private Map<String, List<Map<String, Object>>> snapshots;

    @Column(name = "processing_time_ms")
    private long processingTimeMs;

    @PrePersist
    void onCreate() {
        if (timestamp == null) {
            timestamp = OffsetDateTime.now();
        }
    }
}
