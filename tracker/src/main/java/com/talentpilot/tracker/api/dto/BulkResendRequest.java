package com.talentpilot.tracker.api.dto;

import java.util.List;

/** Request body for POST /bulk/resend. */
public record BulkResendRequest(List<String> candidateIds, String customMessage) {

    public BulkResendRequest {
        if (candidateIds == null) candidateIds = List.of();
    }
}
