package com.talentpilot.tracker.api.dto;

import com.talentpilot.tracker.model.ContactChannel;

import java.util.List;

/** Request body for POST /bulk/contact. messageTemplate is optional. */
public record BulkContactRequest(List<String> candidateIds, ContactChannel channel, String messageTemplate) {

    public BulkContactRequest {
        if (candidateIds == null) candidateIds = List.of();
    }
}
