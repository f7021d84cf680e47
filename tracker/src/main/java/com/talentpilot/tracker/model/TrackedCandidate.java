package com.talentpilot.tracker.model;

import jakarta.persistence.*;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A candidate's outreach record for one role (one row per candidate × role).
 *
 * Status is only ever written by {@link com.talentpilot.tracker.service.TrackingService},
 * which consults the state machine first. isMissingContact and
 * daysWithoutResponse are computed on read and have no column.
 *
 * DB table: tracked_candidates  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tracked_candidates")
public class TrackedCandidate {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "role_id", nullable = false)
    private String roleId;

    @Column(name = "first_name", nullable = false)
    private String firstName;

    @Column(name = "last_name", nullable = false)
    private String lastName;

    private String email;

    private String phone;

    @Column(name = "linkedin_url")
    private String linkedinUrl;

    @Column(name = "role_title", nullable = false)
    private String roleTitle;

    @Column(name = "client_name", nullable = false)
    private String clientName;

    // Acquisition channel: linkedin, referral, email, job_board, ...
    @Column(nullable = false)
    private String source = "manual";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OutreachState status = OutreachState.PENDING_CONTACT;

    // Channel of the last successful send; resends reuse it.
    @Enumerated(EnumType.STRING)
    @Column(name = "last_contact_channel")
    private ContactChannel lastContactChannel;

    @Column(name = "last_contact_at")
    private Instant lastContactAt;

    @Column(name = "response_at")
    private Instant responseAt;

    @Column(name = "response_message", columnDefinition = "TEXT")
    private String responseMessage;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected TrackedCandidate() {}   // required by JPA

    public TrackedCandidate(String roleId, String firstName, String lastName,
                            String roleTitle, String clientName) {
        this.roleId     = roleId;
        this.firstName  = firstName;
        this.lastName   = lastName;
        this.roleTitle  = roleTitle;
        this.clientName = clientName;
    }

    // ------------------------------------------------------------------
    // Derived fields
    // ------------------------------------------------------------------

    /** True iff neither an email nor a phone number is on file. */
    public boolean isMissingContact() {
        return isBlank(email) && isBlank(phone);
    }

    /** True if the given channel has an address to send to. */
    public boolean hasAddressFor(ContactChannel channel) {
        return switch (channel) {
            case EMAIL    -> !isBlank(email);
            case WHATSAPP -> !isBlank(phone);
        };
    }

    /**
     * Whole days since the last contact, projected at {@code now}.
     * Only meaningful while the candidate sits in NO_RESPONSE; null otherwise.
     */
    public Integer daysWithoutResponse(Instant now) {
        if (status != OutreachState.NO_RESPONSE || lastContactAt == null) {
            return null;
        }
        long days = Duration.between(lastContactAt, now).toDays();
        return (int) Math.max(0, days);
    }

    public String fullName() {
        return firstName + " " + lastName;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()                 { return id; }
    public String         getRoleId()             { return roleId; }
    public String         getFirstName()          { return firstName; }
    public String         getLastName()           { return lastName; }
    public String         getEmail()              { return email; }
    public String         getPhone()              { return phone; }
    public String         getLinkedinUrl()        { return linkedinUrl; }
    public String         getRoleTitle()          { return roleTitle; }
    public String         getClientName()         { return clientName; }
    public String         getSource()             { return source; }
    public OutreachState  getStatus()             { return status; }
    public ContactChannel getLastContactChannel() { return lastContactChannel; }
    public Instant        getLastContactAt()      { return lastContactAt; }
    public Instant        getResponseAt()         { return responseAt; }
    public String         getResponseMessage()    { return responseMessage; }
    public String         getNotes()              { return notes; }
    public Instant        getCreatedAt()          { return createdAt; }
    public Instant        getUpdatedAt()          { return updatedAt; }

    public void setEmail(String email)                         { this.email = email; }
    public void setPhone(String phone)                         { this.phone = phone; }
    public void setLinkedinUrl(String linkedinUrl)             { this.linkedinUrl = linkedinUrl; }
    public void setSource(String source)                       { this.source = source; }
    public void setStatus(OutreachState status)                { this.status = status; }
    public void setLastContactChannel(ContactChannel channel)  { this.lastContactChannel = channel; }
    public void setLastContactAt(Instant t)                    { this.lastContactAt = t; }
    public void setResponseAt(Instant t)                       { this.responseAt = t; }
    public void setResponseMessage(String responseMessage)     { this.responseMessage = responseMessage; }
    public void setNotes(String notes)                         { this.notes = notes; }
}
