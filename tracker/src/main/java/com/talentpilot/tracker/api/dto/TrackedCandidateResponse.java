package com.talentpilot.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.talentpilot.tracker.model.ContactChannel;
import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.TrackedCandidate;

import java.time.Instant;
import java.util.UUID;

/**
 * One tracked candidate as the tracking board renders it.
 * isMissingContact and daysWithoutResponse are projected at {@code now}.
 */
public record TrackedCandidateResponse(
        UUID           id,
        String         roleId,
        String         firstName,
        String         lastName,
        String         email,
        String         phone,
        String         linkedinUrl,
        String         roleTitle,
        String         clientName,
        String         source,
        OutreachState  status,
        ContactChannel lastContactChannel,
        Instant        lastContactAt,
        Instant        responseAt,
        String         responseMessage,
        String         notes,
        @JsonProperty("is_missing_contact")
        boolean        isMissingContact,
        Integer        daysWithoutResponse,
        Instant        createdAt,
        Instant        updatedAt
) {
    public static TrackedCandidateResponse from(TrackedCandidate c, Instant now) {
        return new TrackedCandidateResponse(
                c.getId(),
                c.getRoleId(),
                c.getFirstName(),
                c.getLastName(),
                c.getEmail(),
                c.getPhone(),
                c.getLinkedinUrl(),
                c.getRoleTitle(),
                c.getClientName(),
                c.getSource(),
                c.getStatus(),
                c.getLastContactChannel(),
                c.getLastContactAt(),
                c.getResponseAt(),
                c.getResponseMessage(),
                c.getNotes(),
                c.isMissingContact(),
                c.daysWithoutResponse(now),
                c.getCreatedAt(),
                c.getUpdatedAt()
        );
    }
}
