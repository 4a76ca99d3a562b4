package com.carescore.repository;

import com.carescore.model.assessment.Assessment;
import com.carescore.model.enums.RecordStatus;
import com.carescore.model.enums.ToolType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for scored assessments.
 */
@Repository
public interface AssessmentRepository extends JpaRepository<Assessment, String> {

    /**
     * Find a patient's assessments, any status.
     */
    Page<Assessment> findByPatientId(String patientId, Pageable pageable);

    /**
     * Find a patient's assessments with the given status.
     */
    Page<Assessment> findByPatientIdAndStatus(String patientId, RecordStatus status, Pageable pageable);

    /**
     * Find a patient's assessments taken with one tool, oldest first.
     */
    List<Assessment> findByPatientIdAndToolTypeAndStatusNotOrderByCreatedAtAsc(
        String patientId, ToolType toolType, RecordStatus excluded);

    /**
     * Non-archived assessments of a patient.
     */
    @Query("SELECT a FROM Assessment a WHERE a.patientId = :patientId AND a.status <> com.carescore.model.enums.RecordStatus.ARCHIVED")
    List<Assessment> findActiveByPatientId(@Param("patientId") String patientId);
}
