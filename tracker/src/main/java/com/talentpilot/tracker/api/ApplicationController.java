package com.talentpilot.tracker.api;

import com.talentpilot.tracker.api.dto.ApplicationResponse;
import com.talentpilot.tracker.api.dto.StageUpdateRequest;
import com.talentpilot.tracker.model.Application;
import com.talentpilot.tracker.pipeline.ApplicationStageService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * REST API for the hiring funnel of one application.
 *
 * PATCH /api/v1/applications/{id}/stage       move forward, or reject
 * GET   /api/v1/applications/{id}/timeline    funnel stages plus transition history
 */
@RestController
@RequestMapping("/api/v1/applications")
public class ApplicationController {

    private final ApplicationStageService stageService;

    public ApplicationController(ApplicationStageService stageService) {
        this.stageService = stageService;
    }

    /**
     * Returns 409 when the move goes backwards or leaves HIRED / REJECTED.
     */
    @PatchMapping("/{id}/stage")
    public ApplicationResponse updateStage(@PathVariable UUID id, @RequestBody StageUpdateRequest req) {
        if (req.stage() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "stage is required");
        }
        Application moved = stageService.moveTo(id, req.stage(), req.changedBy(), req.notes())
                .orElseThrow(() -> notFound(id));
        return ApplicationResponse.from(moved, stageService.timeline(moved));
    }

    @GetMapping("/{id}/timeline")
    public ApplicationResponse getTimeline(@PathVariable UUID id) {
        Application app = load(id);
        return ApplicationResponse.from(app, stageService.timeline(app));
    }

    private Application load(UUID id) {
        return stageService.findById(id).orElseThrow(() -> notFound(id));
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Application not found: " + id);
    }
}
