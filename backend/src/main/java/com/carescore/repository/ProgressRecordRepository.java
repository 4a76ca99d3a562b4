package com.carescore.repository;

import com.carescore.model.enums.RecordStatus;
import com.carescore.model.progress.ProgressRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for progress records.
 */
@Repository
public interface ProgressRecordRepository extends JpaRepository<ProgressRecord, String> {

    Page<ProgressRecord> findByPatientId(String patientId, Pageable pageable);

    Page<ProgressRecord> findByPatientIdAndStatus(String patientId, RecordStatus status, Pageable pageable);

    /**
     * Non-archived progress records of a patient.
     */
    @Query("SELECT p FROM ProgressRecord p WHERE p.patientId = :patientId AND p.status <> com.carescore.model.enums.RecordStatus.ARCHIVED")
    List<ProgressRecord> findActiveByPatientId(@Param("patientId") String patientId);
}
