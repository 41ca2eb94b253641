package com.catalog.picklist.repository;

import com.catalog.picklist.model.PicklistEntry;
import com.catalog.picklist.model.PicklistType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PicklistEntryRepository extends JpaRepository<PicklistEntry, UUID> {

    List<PicklistEntry> findAllByPicklistTypeOrderByPositionAsc(PicklistType picklistType);

    @Modifying
    @Query("delete from PicklistEntry e where e.picklistType = :type")
    int deleteAllOfType(@Param("type") PicklistType type);
}
