package com.carescore.controller;

import com.carescore.dto.mapper.ClinicalRecordMapper;
import com.carescore.dto.request.CreateAssessmentRequest;
import com.carescore.dto.request.ScorePreviewRequest;
import com.carescore.dto.request.UpdateAssessmentRequest;
import com.carescore.dto.response.ErrorResponse;
import com.carescore.service.AssessmentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.function.Function;

/**
 * REST controller for clinical assessments.
 * The acting clinician is taken from the X-User-Id header.
 */
@RestController
@RequestMapping("/api/assessments")
public class AssessmentController {

    private final AssessmentService assessmentService;
    private final ClinicalRecordMapper mapper;

    public AssessmentController(AssessmentService assessmentService, ClinicalRecordMapper mapper) {
        this.assessmentService = assessmentService;
        this.mapper = mapper;
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    /**
     * List a patient's assessments, newest first unless sorted otherwise.
     */
    @GetMapping
    public ResponseEntity<?> listAssessments(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @RequestParam String patientId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String sort) {
        return ServiceResponses.respond(
            assessmentService.list(actor, patientId, status, page, limit, sort),
            result -> mapper.toPageDto(result, mapper::toSummaryDto));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getAssessment(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String id) {
        return ServiceResponses.respond(assessmentService.get(actor, id), mapper::toDto);
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<?> getHistory(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String id) {
        return ServiceResponses.respond(assessmentService.history(actor, id), Function.identity());
    }

    /**
     * Score trends of one tool for a patient, bucketed by day, week or month.
     */
    @GetMapping("/trends")
    public ResponseEntity<?> getTrends(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @RequestParam String patientId,
            @RequestParam String toolType,
            @RequestParam(defaultValue = "day") String period) {
        return ServiceResponses.respond(
            assessmentService.analyzeTrends(actor, patientId, toolType, period), Function.identity());
    }

    /**
     * Score category values without saving an assessment.
     */
    @PostMapping("/score")
    public ResponseEntity<?> scorePreview(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @Valid @RequestBody ScorePreviewRequest request) {
        return ServiceResponses.respond(
            assessmentService.scorePreview(actor, request.toolType(), request.categories()), Function.identity());
    }

    // ========================================================================
    // Write Operations
    // ========================================================================

    @PostMapping
    public ResponseEntity<?> createAssessment(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @Valid @RequestBody CreateAssessmentRequest request) {
        return ServiceResponses.respond(
            assessmentService.create(actor, request.patientId(), request.toolType(), request.assessmentType(),
                request.categories(), request.draft()),
            mapper::toDto,
            HttpStatus.CREATED);
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> updateAssessment(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String id,
            @RequestBody UpdateAssessmentRequest request) {
        return ServiceResponses.respond(
            assessmentService.update(actor, id, request.categories(), request.status(), request.expectedVersion()),
            mapper::toDto);
    }

    /**
     * Archive an assessment. Assessments are never physically deleted.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<?> archiveAssessment(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String id,
            @RequestParam(required = false) Long expectedVersion) {
        return ServiceResponses.respond(assessmentService.archive(actor, id, expectedVersion), mapper::toDto);
    }

    @PostMapping("/archive")
    public ResponseEntity<?> archivePatientAssessments(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @RequestParam String patientId) {
        return ServiceResponses.respond(
            assessmentService.archiveAllForPatient(actor, patientId),
            count -> Map.of("archived", count));
    }

    // ========================================================================
    // Exception Handlers
    // ========================================================================

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException ex) {
        return ServiceResponses.invalid(ex);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return ServiceResponses.badRequest(ex.getMessage());
    }
}
