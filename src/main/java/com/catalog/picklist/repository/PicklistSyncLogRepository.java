package com.catalog.picklist.repository;

import com.catalog.picklist.model.PicklistSyncLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface PicklistSyncLogRepository extends JpaRepository<PicklistSyncLog, String> {

    List<PicklistSyncLog> findAllByOrderByTimestampDesc(Pageable pageable);

    List<PicklistSyncLog> findBySuccessOrderByTimestampDesc(boolean success, Pageable pageable);

    @Transactional
    @Modifying
    @Query("delete from PicklistSyncLog l where l.timestamp < :cutoff")
    int deleteOlderThan(@Param("cutoff") OffsetDateTime cutoff);
}
