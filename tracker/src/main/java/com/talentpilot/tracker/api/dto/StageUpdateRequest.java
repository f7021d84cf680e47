package com.talentpilot.tracker.api.dto;

import com.talentpilot.tracker.model.PipelineStage;

/**
 * Request body for PATCH /api/v1/applications/{id}/stage.
 * changedBy defaults to "system" when omitted.
 */
public record StageUpdateRequest(PipelineStage stage, String changedBy, String notes) {

    public StageUpdateRequest {
        if (changedBy == null || changedBy.isBlank()) changedBy = "system";
    }
}
