package com.talentpilot.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.talentpilot.tracker.model.OutreachState;

import java.util.List;
import java.util.UUID;

/** Operator actions currently legal for one candidate; the UI shows exactly these. */
public record AllowedActionsResponse(UUID candidateId, OutreachState status,
                                     @JsonProperty("is_missing_contact") boolean isMissingContact, List<String> actions) {}
