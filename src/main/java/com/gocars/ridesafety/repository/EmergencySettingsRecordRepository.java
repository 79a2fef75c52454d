package com.gocars.ridesafety.repository;

import com.gocars.ridesafety.entity.EmergencySettingsRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EmergencySettingsRecordRepository extends JpaRepository<EmergencySettingsRecord, String> {
}
