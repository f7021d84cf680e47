package com.talentpilot.tracker.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One entry in the outreach activity feed. Append-only.
 *
 * DB table: outreach_activity  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "outreach_activity")
public class OutreachActivity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ActivityType type;

    @Column(name = "candidate_id", nullable = false)
    private UUID candidateId;

    @Column(name = "candidate_name", nullable = false)
    private String candidateName;

    @Column(name = "role_id", nullable = false)
    private String roleId;

    @Column(name = "role_title", nullable = false)
    private String roleTitle;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status")
    private OutreachState previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status")
    private OutreachState newStatus;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected OutreachActivity() {}   // required by JPA

    public OutreachActivity(ActivityType type, TrackedCandidate candidate, String message,
                            OutreachState previousStatus, OutreachState newStatus,
                            String createdBy) {
        this.type           = type;
        this.candidateId    = candidate.getId();
        this.candidateName  = candidate.fullName();
        this.roleId         = candidate.getRoleId();
        this.roleTitle      = candidate.getRoleTitle();
        this.message        = message;
        this.previousStatus = previousStatus;
        this.newStatus      = newStatus;
        this.createdBy      = createdBy;
    }

    public UUID          getId()             { return id; }
    public ActivityType  getType()           { return type; }
    public UUID          getCandidateId()    { return candidateId; }
    public String        getCandidateName()  { return candidateName; }
    public String        getRoleId()         { return roleId; }
    public String        getRoleTitle()      { return roleTitle; }
    public String        getMessage()        { return message; }
    public OutreachState getPreviousStatus() { return previousStatus; }
    public OutreachState getNewStatus()      { return newStatus; }
    public String        getCreatedBy()      { return createdBy; }
    public Instant       getCreatedAt()      { return createdAt; }
}
