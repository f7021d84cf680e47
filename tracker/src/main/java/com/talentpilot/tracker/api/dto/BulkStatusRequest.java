package com.talentpilot.tracker.api.dto;

import com.talentpilot.tracker.model.OutreachState;

import java.util.List;

/** Request body for POST /bulk/status. */
public record BulkStatusRequest(List<String> candidateIds, OutreachState status, String notes) {

    public BulkStatusRequest {
        if (candidateIds == null) candidateIds = List.of();
    }
}
