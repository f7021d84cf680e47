package com.talentpilot.tracker.api.dto;

import com.talentpilot.tracker.model.Application;
import com.talentpilot.tracker.model.PipelineStage;
import com.talentpilot.tracker.model.StageTransition;
import com.talentpilot.tracker.pipeline.StageModel.TimelineEntry;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * An application with its funnel timeline and transition history.
 * Returned by both the stage update and the timeline endpoints.
 */
public record ApplicationResponse(
        UUID                 id,
        UUID                 candidateId,
        String               roleId,
        PipelineStage        stage,
        List<StageEntry>     timeline,
        List<TransitionEntry> history,
        Instant              updatedAt
) {
    public record StageEntry(PipelineStage stage, int order, boolean completed, boolean active) {}

    public record TransitionEntry(PipelineStage fromStage, PipelineStage toStage,
                                  String changedBy, String notes, Instant createdAt) {}

    public static ApplicationResponse from(Application app, List<TimelineEntry> timeline) {
        return new ApplicationResponse(
                app.getId(),
                app.getCandidateId(),
                app.getRoleId(),
                app.getStage(),
                timeline.stream()
                        .map(t -> new StageEntry(t.stage(), t.order(), t.completed(), t.active()))
                        .toList(),
                app.getTransitions().stream().map(ApplicationResponse::entry).toList(),
                app.getUpdatedAt()
        );
    }

    private static TransitionEntry entry(StageTransition t) {
        return new TransitionEntry(t.getFromStage(), t.getToStage(), t.getChangedBy(), t.getNotes(), t.getCreatedAt());
    }
}
