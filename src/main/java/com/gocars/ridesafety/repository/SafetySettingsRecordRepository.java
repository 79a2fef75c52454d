package com.gocars.ridesafety.repository;

import com.gocars.ridesafety.entity.SafetySettingsRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SafetySettingsRecordRepository extends JpaRepository<SafetySettingsRecord, String> {
}
