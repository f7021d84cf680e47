package com.talentpilot.tracker.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One recorded funnel move. Rows are never updated or deleted.
 *
 * DB table: stage_transitions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "stage_transitions")
public class StageTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "application_id", nullable = false)
    private Application application;

    // Null for the very first row of an application.
    @Enumerated(EnumType.STRING)
    @Column(name = "from_stage")
    private PipelineStage fromStage;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_stage", nullable = false)
    private PipelineStage toStage;

    @Column(name = "changed_by")
    private String changedBy;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected StageTransition() {}   // required by JPA

    StageTransition(Application application, PipelineStage fromStage, PipelineStage toStage,
                    String changedBy, String notes) {
        this.application = application;
        this.fromStage   = fromStage;
        this.toStage     = toStage;
        this.changedBy   = changedBy;
        this.notes       = notes;
    }

    public UUID          getId()        { return id; }
    public PipelineStage getFromStage() { return fromStage; }
    public PipelineStage getToStage()   { return toStage; }
    public String        getChangedBy() { return changedBy; }
    public String        getNotes()     { return notes; }
    public Instant       getCreatedAt() { return createdAt; }
}
