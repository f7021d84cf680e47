package com.talentpilot.tracker.api.dto;

import com.talentpilot.tracker.grouping.TrackingStatsCalculator.RoleSummary;
import com.talentpilot.tracker.model.OutreachState;

import java.util.LinkedHashMap;
import java.util.Map;

/** Per-role outreach counts for GET /vacantes and the stats breakdown. */
public record RoleSummaryResponse(
        String               roleId,
        String               roleTitle,
        String               clientName,
        Map<String, Integer> stats,
        int                  totalCandidates,
        int                  progressPercentage
) {
    public static RoleSummaryResponse from(RoleSummary s) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map.Entry<OutreachState, Integer> e : s.stats().entrySet()) {
            counts.put(e.getKey().wireName(), e.getValue());
        }
        return new RoleSummaryResponse(s.roleId(), s.roleTitle(), s.clientName(),
                counts, s.totalCandidates(), s.progressPercentage());
    }
}
