package com.carescore.controller;

import com.carescore.dto.mapper.ClinicalRecordMapper;
import com.carescore.dto.request.RiskScoresRequest;
import com.carescore.dto.response.ErrorResponse;
import com.carescore.service.RiskAssessmentService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.function.Function;

/**
 * REST controller for patient risk stratification.
 */
@RestController
@RequestMapping("/api/risk")
public class RiskAssessmentController {

    private final RiskAssessmentService riskService;
    private final ClinicalRecordMapper mapper;

    public RiskAssessmentController(RiskAssessmentService riskService, ClinicalRecordMapper mapper) {
        this.riskService = riskService;
        this.mapper = mapper;
    }

    /**
     * Overall risk from the patient's latest assessments.
     */
    @GetMapping("/patients/{patientId}")
    public ResponseEntity<?> getPatientRisk(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String patientId) {
        return ServiceResponses.respond(riskService.assessPatientRisk(actor, patientId, null), Function.identity());
    }

    /**
     * Overall risk combining the patient's assessments with scores computed elsewhere.
     */
    @PostMapping("/patients/{patientId}")
    public ResponseEntity<?> assessPatientRisk(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @PathVariable String patientId,
            @Valid @RequestBody RiskScoresRequest request) {
        return ServiceResponses.respond(
            riskService.assessPatientRisk(actor, patientId, mapper.toRiskScores(request)), Function.identity());
    }

    /**
     * Aggregate supplied scores only, without reading stored assessments.
     */
    @PostMapping("/aggregate")
    public ResponseEntity<?> aggregate(
            @RequestHeader(value = ServiceResponses.USER_HEADER, required = false) String actor,
            @Valid @RequestBody RiskScoresRequest request) {
        return ServiceResponses.respond(riskService.aggregate(actor, mapper.toRiskScores(request)), Function.identity());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException ex) {
        return ServiceResponses.invalid(ex);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return ServiceResponses.badRequest(ex.getMessage());
    }
}
