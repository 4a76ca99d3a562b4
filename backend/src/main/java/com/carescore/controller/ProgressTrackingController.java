package com.carescore.controller;

import com.carescore.dto.mapper.ClinicalRecordMapper;
import com.carescore.dto.request.CreateProgressRecordRequest;
import com.carescore.dto.request.GoalRequest;
import com.carescore.dto.request.RecordInterventionRequest;
import com.carescore.dto.request.ResetGoalStatusRequest;
import com.carescore.dto.request.UpdateGoalProgressRequest;
import com.carescore.dto.response.ErrorResponse;
import com.carescore.service.ProgressTrackingService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.function.Function;

/**
 * REST controller for care progress records: goals, interventions and analytics.
 */
@RestController
@RequestMapping("/api/progress")
public class ProgressTrackingController {

    private final ProgressTrackingService progressService;
    private final ClinicalRecordMapper mapper;

    public ProgressTrackingController(ProgressTrackingService progressService, ClinicalRecordMapper mapper) {
        this.progressService = progressService;
        this.mapper = mapper;
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    @GetMapping
    public ResponseEntity<?> listRecords(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @RequestParam String patientId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String sort) {
        return ServiceResponses.respond(
            progressService.list(actor, patientId, status, page, limit, sort),
            result -> mapper.toPageDto(result, mapper::toDto));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getRecord(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String id) {
        return ServiceResponses.respond(progressService.get(actor, id), mapper::toDto);
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<?> getHistory(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String id) {
        return ServiceResponses.respond(progressService.history(actor, id), Function.identity());
    }

    /**
     * Metrics, goal analytics, alerts, predictions and trends for one record.
     */
    @GetMapping("/{id}/analytics")
    public ResponseEntity<?> getAnalytics(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String id) {
        return ServiceResponses.respond(progressService.analytics(actor, id), Function.identity());
    }

    // ========================================================================
    // Write Operations
    // ========================================================================

    @PostMapping
    public ResponseEntity<?> createRecord(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @Valid @RequestBody CreateProgressRecordRequest request) {
        return ServiceResponses.respond(
            progressService.createRecord(actor, request.patientId(), mapper.toGoalDrafts(request.goals())),
            mapper::toDto,
            HttpStatus.CREATED);
    }

    @PostMapping("/{id}/goals")
    public ResponseEntity<?> addGoal(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String id,
            @RequestParam(required = false) Long expectedVersion,
            @Valid @RequestBody GoalRequest request) {
        return ServiceResponses.respond(
            progressService.addGoal(actor, id, mapper.toGoalDraft(request), expectedVersion),
            mapper::toDto,
            HttpStatus.CREATED);
    }

    @PutMapping("/{id}/goals/{goalId}/progress")
    public ResponseEntity<?> updateGoalProgress(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String id,
            @PathVariable String goalId,
            @Valid @RequestBody UpdateGoalProgressRequest request) {
        return ServiceResponses.respond(
            progressService.updateGoalProgress(actor, id, goalId, request.currentValue(), request.expectedVersion()),
            mapper::toDto);
    }

    /**
     * Clinician override of a goal's status, e.g. reopening an overdue goal.
     */
    @PutMapping("/{id}/goals/{goalId}/status")
    public ResponseEntity<?> resetGoalStatus(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String id,
            @PathVariable String goalId,
            @Valid @RequestBody ResetGoalStatusRequest request) {
        return ServiceResponses.respond(
            progressService.resetGoalStatus(actor, id, goalId, request.status(), request.expectedVersion()),
            mapper::toDto);
    }

    @PostMapping("/{id}/interventions")
    public ResponseEntity<?> recordIntervention(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String id,
            @Valid @RequestBody RecordInterventionRequest request) {
        return ServiceResponses.respond(
            progressService.recordIntervention(actor, id, mapper.toInterventionDraft(request), request.expectedVersion()),
            mapper::toDto,
            HttpStatus.CREATED);
    }

    @PostMapping("/{id}/refresh")
    public ResponseEntity<?> refreshStatuses(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String id) {
        return ServiceResponses.respond(progressService.refreshStatuses(actor, id), mapper::toDto);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> archiveRecord(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String id,
            @RequestParam(required = false) Long expectedVersion) {
        return ServiceResponses.respond(progressService.archive(actor, id, expectedVersion), mapper::toDto);
    }

    @PostMapping("/archive")
    public ResponseEntity<?> archivePatientRecords(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @RequestParam String patientId) {
        return ServiceResponses.respond(
            progressService.archiveAllForPatient(actor, patientId),
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
