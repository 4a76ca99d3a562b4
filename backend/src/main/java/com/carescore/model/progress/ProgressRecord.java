package com.carescore.model.progress;

import com.carescore.model.AuditableEntity;
import com.carescore.model.HistoryEntry;
import com.carescore.model.converter.GoalListConverter;
import com.carescore.model.converter.HistoryListConverter;
import com.carescore.model.converter.InterventionListConverter;
import com.carescore.model.converter.ProgressMetricsConverter;
import com.carescore.model.enums.RecordStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Goal-directed care progress for one patient: SMART goals, interventions and an audit trail.
 */
@Entity
@Table(name = "progress_record", indexes = {
    @Index(name = "idx_progress_patient", columnList = "patient_id"),
    @Index(name = "idx_progress_status", columnList = "status")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressRecord extends AuditableEntity {

    @Id
    @Column(length = 255)
    private String id;

    @Column(name = "patient_id", nullable = false, length = 255)
    private String patientId;

    @Column(name = "author_id", nullable = false, length = 255)
    private String authorId;

    @Convert(converter = GoalListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<Goal> goals = new ArrayList<>();

    @Convert(converter = InterventionListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<Intervention> interventions = new ArrayList<>();

    @Convert(converter = ProgressMetricsConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private ProgressMetrics metrics = new ProgressMetrics();

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private RecordStatus status;

    @Column(name = "record_version", nullable = false)
    private long version;

    @Convert(converter = HistoryListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<HistoryEntry> history = new ArrayList<>();

    public Optional<Goal> findGoal(String goalId) {
        if (goalId == null) {
            return Optional.empty();
        }
        return goals.stream().filter(g -> goalId.equals(g.getId())).findFirst();
    }

    /**
     * Appends an audit entry and bumps the version.
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
