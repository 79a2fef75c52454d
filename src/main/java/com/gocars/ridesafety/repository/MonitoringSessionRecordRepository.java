package com.gocars.ridesafety.repository;

import com.gocars.ridesafety.entity.MonitoringSessionRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MonitoringSessionRecordRepository extends JpaRepository<MonitoringSessionRecord, String> {

    /**
     * Locks the row (SELECT FOR UPDATE) so two writers of the same session compare versions one
     * after the other; without it both could read v5 and the older snapshot could land last.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM MonitoringSessionRecord s WHERE s.id = :id")
    Optional<MonitoringSessionRecord> findByIdForUpdate(@Param("id") String id);
}
