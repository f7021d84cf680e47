package com.talentpilot.tracker.service;

import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.TrackedCandidate;

import java.util.List;
import java.util.Map;

/**
 * Read model returned by {@link TrackingService#fetchTracking}: candidates
 * bucketed by status plus the overall count. Not cached.
 */
public record TrackingSnapshot(Map<OutreachState, List<TrackedCandidate>> byStatus, int total) {}
