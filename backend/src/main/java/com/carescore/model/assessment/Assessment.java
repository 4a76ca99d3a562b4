package com.carescore.model.assessment;

import com.carescore.model.AuditableEntity;
import com.carescore.model.HistoryEntry;
import com.carescore.model.converter.CategoryScoresConverter;
import com.carescore.model.converter.HistoryListConverter;
import com.carescore.model.converter.StringListConverter;
import com.carescore.model.enums.AssessmentType;
import com.carescore.model.enums.RecordStatus;
import com.carescore.model.enums.RiskLevel;
import com.carescore.model.enums.ToolType;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A scored clinical assessment taken with one standardized tool.
 * <p>
 * {@code totalScore} and {@code riskLevel} are always derived from {@code categories} by the
 * scoring engine; they are rewritten on every mutation and never accepted from callers.
 */
@Entity
@Table(name = "assessment", indexes = {
    @Index(name = "idx_assessment_patient", columnList = "patient_id"),
    @Index(name = "idx_assessment_patient_tool", columnList = "patient_id, tool_type"),
    @Index(name = "idx_assessment_status", columnList = "status")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class Assessment extends AuditableEntity {

    @Id
    @Column(length = 255)
    private String id;

    @Column(name = "patient_id", nullable = false, length = 255)
    private String patientId;

    @Column(name = "author_id", nullable = false, length = 255)
    private String authorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "assessment_type", nullable = false, length = 50)
    private AssessmentType assessmentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "tool_type", nullable = false, length = 20)
    private ToolType toolType;

    /**
     * Raw per-category values as entered, keyed by the tool's category names.
     */
    @Convert(converter = CategoryScoresConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Integer> categories = new LinkedHashMap<>();

    @Column(name = "total_score")
    private Integer totalScore;

    /**
     * Band label from the tool's own scale (e.g. "moderate", "no_risk", "mild").
     */
    @Column(name = "risk_level", length = 30)
    private String riskLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "normalized_risk", length = 20)
    private RiskLevel normalizedRisk;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private RecordStatus status;

    @Column(name = "record_version", nullable = false)
    private long version;

    @Convert(converter = StringListConverter.class)
    @Column(name = "scoring_warnings", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    @Convert(converter = HistoryListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<HistoryEntry> history = new ArrayList<>();

    /**
     * Appends an audit entry and bumps the version. This is the only way the version moves.
     */
    public void appendHistory(HistoryEntry entry) {
        version++;
        entry.setVersion(version);
        history.add(entry);
    }

    public boolean isArchived() {
        return status == RecordStatus.ARCHIVED;
    }
}
