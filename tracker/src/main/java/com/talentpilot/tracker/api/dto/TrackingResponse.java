package com.talentpilot.tracker.api.dto;

import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.TrackedCandidate;
import com.talentpilot.tracker.service.TrackingSnapshot;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response body for GET /api/v1/tracking/candidates.
 * by_status holds every status key, empty buckets included.
 */
public record TrackingResponse(Map<String, List<TrackedCandidateResponse>> byStatus, int total) {

    public static TrackingResponse from(TrackingSnapshot snapshot, Instant now) {
        Map<String, List<TrackedCandidateResponse>> buckets = new LinkedHashMap<>();
        for (Map.Entry<OutreachState, List<TrackedCandidate>> e : snapshot.byStatus().entrySet()) {
            buckets.put(e.getKey().wireName(),
                    e.getValue().stream().map(c -> TrackedCandidateResponse.from(c, now)).toList());
        }
        return new TrackingResponse(buckets, snapshot.total());
    }
}
