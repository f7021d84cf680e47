package com.talentpilot.tracker.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A candidate's position in the recruiting funnel for one role.
 *
 * Decoupled from outreach status: a candidate can be INTERESTED in outreach
 * terms while still sitting in SHORTLIST here. Stage moves are validated by
 * {@link com.talentpilot.tracker.pipeline.StageModel} and recorded as
 * append-only {@link StageTransition} rows.
 *
 * DB table: applications  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "applications")
public class Application {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "candidate_id", nullable = false)
    private UUID candidateId;

    @Column(name = "role_id", nullable = false)
    private String roleId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelineStage stage = PipelineStage.SOURCING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @OneToMany(mappedBy = "application", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("createdAt ASC")
    private List<StageTransition> transitions = new ArrayList<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Application() {}   // required by JPA

    public Application(UUID candidateId, String roleId) {
        this.candidateId = candidateId;
        this.roleId      = roleId;
    }

    /**
     * Move to {@code to} and append the matching transition row.
     * Callers validate the move first; this only records it.
     */
    public StageTransition recordTransition(PipelineStage to, String changedBy, String notes) {
        StageTransition t = new StageTransition(this, stage, to, changedBy, notes);
        transitions.add(t);
        this.stage = to;
        return t;
    }

    public UUID          getId()          { return id; }
    public UUID          getCandidateId() { return candidateId; }
    public String        getRoleId()      { return roleId; }
    public PipelineStage getStage()       { return stage; }
    public Instant       getCreatedAt()   { return createdAt; }
    public Instant       getUpdatedAt()   { return updatedAt; }

    public List<StageTransition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }
}
