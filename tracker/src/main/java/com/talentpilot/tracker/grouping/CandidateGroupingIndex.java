package com.talentpilot.tracker.grouping;

import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.TrackedCandidate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pure query functions behind the Kanban view.
 *
 * Nothing here touches the database or mutates its arguments; the same
 * input always yields the same output. Time-dependent queries take
 * {@code now} explicitly.
 */
@Component
public class CandidateGroupingIndex {

    /**
     * Bucket candidates by status. Every {@link OutreachState} key is present
     * (possibly with an empty list) and each bucket keeps input order.
     */
    public Map<OutreachState, List<TrackedCandidate>> groupByStatus(Collection<TrackedCandidate> candidates) {
        Map<OutreachState, List<TrackedCandidate>> buckets = new EnumMap<>(OutreachState.class);
        for (OutreachState s : OutreachState.values()) {
            buckets.put(s, new ArrayList<>());
        }
        for (TrackedCandidate c : candidates) {
            buckets.get(c.getStatus()).add(c);
        }
        buckets.replaceAll((s, list) -> Collections.unmodifiableList(list));
        return Collections.unmodifiableMap(buckets);
    }

    /**
     * Status filter (OR over the set) AND search AND creation-date range AND
     * replied/not-replied. An empty filter returns a copy of the input.
     */
    public List<TrackedCandidate> applyFilters(Collection<TrackedCandidate> candidates, TrackingFilters filters) {
        TrackingFilters f = filters == null ? TrackingFilters.none() : filters;
        String needle = f.hasSearch() ? f.search().toLowerCase(Locale.ROOT) : null;
        return candidates.stream()
                .filter(c -> !f.hasStatusFilter() || f.status().contains(c.getStatus()))
                .filter(c -> needle == null || matchesSearch(c, needle))
                .filter(c -> !f.hasDateRange() || createdWithin(c, f.dateFrom(), f.dateTo()))
                .filter(c -> !f.hasResponseFilter() || f.hasResponse() == (c.getResponseAt() != null))
                .toList();
    }

    /**
     * NO_RESPONSE candidates that have waited at least {@code minDays} and
     * still have a way to be reached.
     */
    public List<TrackedCandidate> resendEligible(Collection<TrackedCandidate> candidates,
                                                 int minDays, Instant now) {
        return candidates.stream()
                .filter(c -> c.getStatus() == OutreachState.NO_RESPONSE)
                .filter(c -> !c.isMissingContact())
                .filter(c -> {
                    Integer days = c.daysWithoutResponse(now);
                    return days != null && days >= minDays;
                })
                .toList();
    }

    /** Both bounds inclusive. */
    private static boolean createdWithin(TrackedCandidate c, Instant from, Instant to) {
        Instant created = c.getCreatedAt();
        if (from != null && created.isBefore(from)) {
            return false;
        }
        return to == null || !created.isAfter(to);
    }

    private static boolean matchesSearch(TrackedCandidate c, String needle) {
        String name = (c.getFirstName() + " " + c.getLastName()).toLowerCase(Locale.ROOT);
        if (name.contains(needle)) {
            return true;
        }
        return c.getEmail() != null && c.getEmail().toLowerCase(Locale.ROOT).contains(needle);
    }
}
