package com.catalog.picklist.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A candidate value that could not be resolved against its picklist. One row per
 * (match_type, normalized_value, source); repeats bump {@code occurrenceCount}.
 *
 * Rows are written through the native upsert in {@code MismatchRecordRepository} and are never deleted.
 */
@Setter
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "picklist_mismatches",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_picklist_mismatches_key",
                columnNames = {"match_type", "normalized_value", "source"}),
        indexes = {
                @Index(name = "idx_picklist_mismatches_resolved_occurrences", columnList = "resolved, occurrence_count"),
                @Index(name = "idx_picklist_mismatches_last_seen", columnList = "last_seen"),
                @Index(name = "idx_picklist_mismatches_catalog", columnList = "catalog_id"),
                @Index(name = "idx_picklist_mismatches_session", columnList = "session_id")
        })
public class MismatchRecord {

    @Id
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_type", nullable = false, length = 16)
    private PicklistType matchType;

    @Column(name = "attempted_value", nullable = false, columnDefinition = "TEXT")
    private String attemptedValue;

    @Column(name = "normalized_value", nullable = false, columnDefinition = "TEXT")
    private String normalizedValue;

    @Column(name = "source", nullable = false)
    private String source;

    // Field key of the consuming record, e.g. "height" for top-level attributes.
    @Column(name = "field_key")
    private String fieldKey;

    @Column(name = "similarity", nullable = false)
    private double similarity;

    @Column(name = "match_threshold", nullable = false)
    private double matchThreshold;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "closest_matches")
    private List<ClosestMatch> closestMatches;

    @Column(name = "occurrence_count", nullable = false)
    private long occurrenceCount;

    @Column(name = "first_seen", nullable = false)
    private OffsetDateTime firstSeen;

    @Column(name = "last_seen", nullable = false)
    private OffsetDateTime lastSeen;

    @Column(name = "catalog_id")
    private String catalogId;

    @Column(name = "catalog_name")
    private String catalogName;

    @Column(name = "model_number")
    private String modelNumber;

    @Column(name = "product_brand")
    private String productBrand;

    @Column(name = "product_category")
    private String productCategory;

    @Column(name = "session_id")
    private String sessionId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "ai_context")
    private Map<String, Object> aiContext;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_data_context")
    private Map<String, Object> rawDataContext;

    @Column(name = "resolved", nullable = false)
    private boolean resolved;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_action", length = 32)
    private ResolutionAction resolutionAction;

    @Column(name = "resolved_value", columnDefinition = "TEXT")
    private String resolvedValue;

    @Column(name = "resolved_to", columnDefinition = "TEXT")
    private String resolvedTo;

    @Column(name = "resolution_notes", columnDefinition = "TEXT")
    private String resolutionNotes;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "resolved_at")
    private OffsetDateTime resolvedAt;
}
