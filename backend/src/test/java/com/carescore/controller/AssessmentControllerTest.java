package com.carescore.controller;

import com.carescore.dto.mapper.ClinicalRecordMapper;
import com.carescore.exception.RateLimitException;
import com.carescore.exception.StaleVersionException;
import com.carescore.model.assessment.Assessment;
import com.carescore.model.enums.AssessmentType;
import com.carescore.model.enums.RecordStatus;
import com.carescore.model.enums.RiskLevel;
import com.carescore.model.enums.ToolType;
import com.carescore.service.AssessmentService;
import com.carescore.service.FacadeBoundary;
import com.carescore.service.ServiceError;
import com.carescore.service.ServiceResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssessmentController Unit Tests")
class AssessmentControllerTest {

    @Mock
    private AssessmentService assessmentService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
            .standaloneSetup(new AssessmentController(assessmentService, new ClinicalRecordMapper()))
            .build();
    }

    private static Assessment assessment() {
        return Assessment.builder()
            .id("asmt-1")
            .patientId("patient-1")
            .authorId("nurse-1")
            .assessmentType(AssessmentType.FALL_RISK)
            .toolType(ToolType.MORSE)
            .categories(Map.of("gait", 10))
            .totalScore(10)
            .riskLevel("low")
            .normalizedRisk(RiskLevel.LOW)
            .status(RecordStatus.ACTIVE)
            .version(1)
            .createdAt(Instant.parse("2026-03-02T09:00:00Z"))
            .build();
    }

    @Test
    @DisplayName("Should create an assessment and answer 201")
    void shouldCreate() throws Exception {
        // Given
        when(assessmentService.create(eq("nurse-1"), eq("patient-1"), eq("morse"), any(), any(), anyBoolean()))
            .thenReturn(ServiceResult.ok(assessment()));

        // When / Then
        mockMvc.perform(post("/api/assessments")
                .header("X-User-Id", "nurse-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"patientId\":\"patient-1\",\"toolType\":\"morse\",\"categories\":{\"gait\":10}}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("asmt-1"))
            .andExpect(jsonPath("$.toolType").value("morse"))
            .andExpect(jsonPath("$.totalScore").value(10));
    }

    @Test
    @DisplayName("Should reject a body without a patient before reaching the service")
    void shouldRejectInvalidBody() throws Exception {
        mockMvc.perform(post("/api/assessments")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"toolType\":\"morse\",\"categories\":{}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_FAILURE"))
            .andExpect(jsonPath("$.field").value("patientId"));

        verify(assessmentService, never()).create(any(), any(), any(), any(), any(), anyBoolean());
    }

    @Test
    @DisplayName("Should map a missing assessment to 404")
    void shouldMapNotFound() throws Exception {
        when(assessmentService.get(any(), eq("asmt-9")))
            .thenReturn(ServiceResult.failure(ServiceError.of(FacadeBoundary.NOT_FOUND, "Assessment not found: asmt-9")));

        mockMvc.perform(get("/api/assessments/asmt-9"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Assessment not found: asmt-9"));
    }

    @Test
    @DisplayName("Should map a stale version to 409")
    void shouldMapStaleVersion() throws Exception {
        when(assessmentService.archive(any(), eq("asmt-1"), eq(3L)))
            .thenReturn(ServiceResult.failure(ServiceError.of(StaleVersionException.CODE, "stale")));

        mockMvc.perform(delete("/api/assessments/asmt-1").param("expectedVersion", "3"))
            .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Should answer 429 with Retry-After when rate limited")
    void shouldMapRateLimit() throws Exception {
        when(assessmentService.get(anyString(), anyString())).thenReturn(ServiceResult.failure(
            new ServiceError(RateLimitException.CODE, "Rate limit exceeded", null, 30L)));

        mockMvc.perform(get("/api/assessments/asmt-1").header("X-User-Id", "nurse-1"))
            .andExpect(status().isTooManyRequests())
            .andExpect(header().string("Retry-After", "30"))
            .andExpect(jsonPath("$.retryAfterSeconds").value(30));
    }

    @Test
    @DisplayName("Should report how many assessments were archived")
    void shouldArchiveAllForPatient() throws Exception {
        when(assessmentService.archiveAllForPatient(any(), eq("patient-1"))).thenReturn(ServiceResult.ok(2));

        mockMvc.perform(post("/api/assessments/archive").param("patientId", "patient-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.archived").value(2));
    }
}
