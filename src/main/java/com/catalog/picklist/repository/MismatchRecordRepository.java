package com.catalog.picklist.repository;

import com.catalog.picklist.model.MismatchRecord;
import com.catalog.picklist.model.PicklistType;
import com.catalog.picklist.model.ResolutionAction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface MismatchRecordRepository extends JpaRepository<MismatchRecord, UUID>, MismatchRecordRepositoryCustom {

    /**
     * Inserts a new record or bumps the occurrence count of the existing one. The increment
     * happens in the database so concurrent writers never lose an observation. Resolution
     * fields of an existing record are left untouched. Nullable parameters carry an explicit
     * cast because a null bound without a type reaches PostgreSQL untyped.
     */
    @Modifying
    @Query(value = """
            insert into picklist_mismatches (
                id, match_type, attempted_value, normalized_value, source, field_key,
                similarity, match_threshold, closest_matches, occurrence_count, first_seen, last_seen,
                catalog_id, catalog_name, model_number, product_brand, product_category, session_id,
                ai_context, raw_data_context, resolved)
            values (
                :id, :matchType, :attemptedValue, :normalizedValue, :source, cast(:fieldKey as text),
                :similarity, :matchThreshold, cast(cast(:closestMatches as text) as jsonb), 1, :seenAt, :seenAt,
                cast(:catalogId as text), cast(:catalogName as text), cast(:modelNumber as text),
                cast(:productBrand as text), cast(:productCategory as text), cast(:sessionId as text),
                cast(cast(:aiContext as text) as jsonb), cast(cast(:rawDataContext as text) as jsonb), false)
            on conflict (match_type, normalized_value, source) do update set
                occurrence_count = picklist_mismatches.occurrence_count + 1,
                last_seen = excluded.last_seen,
                attempted_value = excluded.attempted_value,
                similarity = excluded.similarity,
                match_threshold = excluded.match_threshold,
                closest_matches = excluded.closest_matches,
                field_key = coalesce(excluded.field_key, picklist_mismatches.field_key),
                catalog_id = coalesce(excluded.catalog_id, picklist_mismatches.catalog_id),
                catalog_name = coalesce(excluded.catalog_name, picklist_mismatches.catalog_name),
                model_number = coalesce(excluded.model_number, picklist_mismatches.model_number),
                product_brand = coalesce(excluded.product_brand, picklist_mismatches.product_brand),
                product_category = coalesce(excluded.product_category, picklist_mismatches.product_category),
                session_id = coalesce(excluded.session_id, picklist_mismatches.session_id),
                ai_context = coalesce(excluded.ai_context, picklist_mismatches.ai_context),
                raw_data_context = coalesce(excluded.raw_data_context, picklist_mismatches.raw_data_context)
            """, nativeQuery = true)
    int upsert(@Param("id") UUID id,
               @Param("matchType") String matchType,
               @Param("attemptedValue") String attemptedValue,
               @Param("normalizedValue") String normalizedValue,
               @Param("source") String source,
               @Param("fieldKey") String fieldKey,
               @Param("similarity") double similarity,
               @Param("matchThreshold") double matchThreshold,
               @Param("closestMatches") String closestMatches,
               @Param("seenAt") OffsetDateTime seenAt,
               @Param("catalogId") String catalogId,
               @Param("catalogName") String catalogName,
               @Param("modelNumber") String modelNumber,
               @Param("productBrand") String productBrand,
               @Param("productCategory") String productCategory,
               @Param("sessionId") String sessionId,
               @Param("aiContext") String aiContext,
               @Param("rawDataContext") String rawDataContext);

    long countByResolved(boolean resolved);

    @Query("select m.matchType, count(m) from MismatchRecord m where m.resolved = false group by m.matchType")
    List<Object[]> countUnresolvedByType();

    @Query("select m.source, count(m) from MismatchRecord m where m.resolved = false group by m.source")
    List<Object[]> countUnresolvedBySource();

    @Query("""
            select m from MismatchRecord m
            where m.resolved = false and (:type is null or m.matchType = :type)
            order by m.occurrenceCount desc, m.lastSeen desc
            """)
    List<MismatchRecord> findTopUnresolved(@Param("type") PicklistType type, Pageable pageable);

    @Query("""
            select m from MismatchRecord m
            where m.resolved = false and m.similarity >= :minSimilarity and m.similarity < :maxSimilarity
            order by m.similarity desc, m.occurrenceCount desc
            """)
    List<MismatchRecord> findNearMisses(@Param("minSimilarity") double minSimilarity,
                                        @Param("maxSimilarity") double maxSimilarity,
                                        Pageable pageable);

    List<MismatchRecord> findByMatchTypeAndNormalizedValue(PicklistType matchType, String normalizedValue);

    List<MismatchRecord> findByMatchTypeAndNormalizedValueAndSource(PicklistType matchType,
                                                                    String normalizedValue,
                                                                    String source);

    List<MismatchRecord> findByCatalogIdOrderByLastSeenDesc(String catalogId);

    List<MismatchRecord> findBySessionIdOrderByLastSeenDesc(String sessionId);

    /**
     * Resolves the unresolved records for a type and value, optionally narrowed to one source.
     * Already-resolved records are never touched.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update MismatchRecord m
            set m.resolved = true,
                m.resolutionAction = :action,
                m.resolvedValue = :resolvedValue,
                m.resolvedTo = :resolvedTo,
                m.resolutionNotes = :notes,
                m.resolvedBy = :resolvedBy,
                m.resolvedAt = :resolvedAt
            where m.matchType = :type
              and m.normalizedValue = :normalizedValue
              and (:source is null or m.source = :source)
              and m.resolved = false
            """)
    int resolveUnresolved(@Param("type") PicklistType type,
                          @Param("normalizedValue") String normalizedValue,
                          @Param("source") String source,
                          @Param("action") ResolutionAction action,
                          @Param("resolvedValue") String resolvedValue,
                          @Param("resolvedTo") String resolvedTo,
                          @Param("notes") String notes,
                          @Param("resolvedBy") String resolvedBy,
                          @Param("resolvedAt") OffsetDateTime resolvedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update MismatchRecord m
            set m.resolved = true,
                m.resolutionAction = :action,
                m.resolvedValue = :resolvedValue,
                m.resolvedTo = :resolvedTo,
                m.resolutionNotes = :notes,
                m.resolvedBy = :resolvedBy,
                m.resolvedAt = :resolvedAt
            where m.id in :ids and m.resolved = false
            """)
    int resolveByIds(@Param("ids") Collection<UUID> ids,
                     @Param("action") ResolutionAction action,
                     @Param("resolvedValue") String resolvedValue,
                     @Param("resolvedTo") String resolvedTo,
                     @Param("notes") String notes,
                     @Param("resolvedBy") String resolvedBy,
                     @Param("resolvedAt") OffsetDateTime resolvedAt);
}
