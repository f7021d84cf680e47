package com.talentpilot.tracker.api.dto;

import com.talentpilot.tracker.model.OutreachActivity;
import com.talentpilot.tracker.model.OutreachState;

import java.time.Instant;
import java.util.UUID;

/** One entry of the recent-activity feed. */
public record ActivityResponse(
        UUID          id,
        String        type,
        UUID          candidateId,
        String        candidateName,
        String        roleId,
        String        roleTitle,
        String        message,
        OutreachState previousStatus,
        OutreachState newStatus,
        String        createdBy,
        Instant       createdAt
) {
    public static ActivityResponse from(OutreachActivity a) {
        return new ActivityResponse(
                a.getId(),
                a.getType().wireName(),
                a.getCandidateId(),
                a.getCandidateName(),
                a.getRoleId(),
                a.getRoleTitle(),
                a.getMessage(),
                a.getPreviousStatus(),
                a.getNewStatus(),
                a.getCreatedBy(),
                a.getCreatedAt()
        );
    }
}
