package com.talentpilot.tracker.api.dto;

import com.talentpilot.tracker.grouping.TrackingStatsCalculator.TrackingStats;

import java.util.List;

public record StatsResponse(
        int    totalCandidates,
        String responseRate,
        String interestRate,
        String avgResponseTime,
        String conversionRate,
        List<RoleSummaryResponse> byRole
) {
    public static StatsResponse from(TrackingStats s) {
        return new StatsResponse(s.totalCandidates(), s.responseRate(), s.interestRate(),
                s.avgResponseTime(), s.conversionRate(),
                s.byRole().stream().map(RoleSummaryResponse::from).toList());
    }
}
