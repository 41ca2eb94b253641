package com.catalog.picklist.repository;

import com.catalog.picklist.dto.MismatchQuery;
import com.catalog.picklist.model.MismatchRecord;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class MismatchRecordRepositoryImpl implements MismatchRecordRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<MismatchRecord> search(MismatchQuery query) {
        Map<String, Object> params = new LinkedHashMap<>();
        String where = whereClause(query, params);
        // sort property comes from a fixed allow-list in MismatchQuery
        String jpql = "select m from MismatchRecord m" + where
                + " order by m." + query.effectiveSortBy() + (query.ascending() ? " asc" : " desc")
                + ", m.id asc";

        TypedQuery<MismatchRecord> q = entityManager.createQuery(jpql, MismatchRecord.class);
        params.forEach(q::setParameter);
        q.setFirstResult(query.effectiveSkip());
        q.setMaxResults(query.effectiveLimit());
        return q.getResultList();
    }

    @Override
    public long countMatching(MismatchQuery query) {
        Map<String, Object> params = new LinkedHashMap<>();
        String where = whereClause(query, params);
        TypedQuery<Long> q = entityManager.createQuery("select count(m) from MismatchRecord m" + where, Long.class);
        params.forEach(q::setParameter);
        return q.getSingleResult();
    }

    private static String whereClause(MismatchQuery query, Map<String, Object> params) {
        List<String> conditions = new ArrayList<>();
        if (query.getType() != null) {
            conditions.add("m.matchType = :type");
            params.put("type", query.getType());
        }
        if (query.getSource() != null && !query.getSource().isBlank()) {
            conditions.add("m.source = :source");
            params.put("source", query.getSource());
        }
        if (query.getResolved() != null) {
            conditions.add("m.resolved = :resolved");
            params.put("resolved", query.getResolved());
        }
        if (query.getCategory() != null && !query.getCategory().isBlank()) {
            conditions.add("lower(m.productCategory) = lower(:category)");
            params.put("category", query.getCategory());
        }
        if (query.getMinOccurrences() != null) {
            conditions.add("m.occurrenceCount >= :minOccurrences");
            params.put("minOccurrences", query.getMinOccurrences());
        }
        if (query.getMinSimilarity() != null) {
            conditions.add("m.similarity >= :minSimilarity");
            params.put("minSimilarity", query.getMinSimilarity());
        }
        if (query.getMaxSimilarity() != null) {
            conditions.add("m.similarity <= :maxSimilarity");
            params.put("maxSimilarity", query.getMaxSimilarity());
        }
        if (query.getLastSeenFrom() != null) {
            conditions.add("m.lastSeen >= :lastSeenFrom");
            params.put("lastSeenFrom", query.getLastSeenFrom());
        }
        if (query.getLastSeenTo() != null) {
            conditions.add("m.lastSeen <= :lastSeenTo");
            params.put("lastSeenTo", query.getLastSeenTo());
        }
        return conditions.isEmpty() ? "" : " where " + String.join(" and ", conditions);
    }
}
