package com.gocars.ridesafety.repository;

import com.gocars.ridesafety.entity.EmergencyContactRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EmergencyContactRecordRepository extends JpaRepository<EmergencyContactRecord, Long> {

    List<EmergencyContactRecord> findByUserIdOrderByIdAsc(String userId);
}
