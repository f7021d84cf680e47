package com.talentpilot.tracker.api.dto;

import com.talentpilot.tracker.model.OutreachState;

/** Request body for PATCH /candidates/{id}/status and the override endpoint. */
public record StatusUpdateRequest(OutreachState status, String notes) {}
