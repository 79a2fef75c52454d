package com.gocars.ridesafety.repository;

import com.gocars.ridesafety.entity.EmergencyIncidentRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EmergencyIncidentRecordRepository extends JpaRepository<EmergencyIncidentRecord, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM EmergencyIncidentRecord i WHERE i.id = :id")
    Optional<EmergencyIncidentRecord> findByIdForUpdate(@Param("id") String id);
}
