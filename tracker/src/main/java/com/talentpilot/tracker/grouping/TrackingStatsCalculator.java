package com.talentpilot.tracker.grouping;

import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.TrackedCandidate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Outreach funnel statistics, computed from the current collection.
 *
 * Rates use the contacted base (everyone past PENDING_CONTACT) except the
 * conversion rate, which uses the whole population.
 */
@Component
public class TrackingStatsCalculator {

    private static final Set<OutreachState> RESPONDED = EnumSet.of(
            OutreachState.INTERESTED, OutreachState.NOT_INTERESTED,
            OutreachState.SCHEDULED, OutreachState.COMPLETED, OutreachState.HIRED);

    private static final Set<OutreachState> INTERESTED_OR_BEYOND = EnumSet.of(
            OutreachState.INTERESTED, OutreachState.SCHEDULED,
            OutreachState.COMPLETED, OutreachState.HIRED);

    private static final Set<OutreachState> AWAITING = EnumSet.of(
            OutreachState.PENDING_CONTACT, OutreachState.CONTACTED, OutreachState.NO_RESPONSE);

    public record TrackingStats(
            int    totalCandidates,
            String responseRate,
            String interestRate,
            String avgResponseTime,
            String conversionRate,
            List<RoleSummary> byRole) {}

    public record RoleSummary(
            String roleId,
            String roleTitle,
            String clientName,
            Map<OutreachState, Integer> stats,
            int totalCandidates,
            int progressPercentage) {}

    public TrackingStats stats(Collection<TrackedCandidate> candidates) {
        Map<OutreachState, Integer> counts = countByStatus(candidates);
        int total     = candidates.size();
        int contacted = total - counts.get(OutreachState.PENDING_CONTACT);
        int responded = sum(counts, RESPONDED);
        int interest  = sum(counts, INTERESTED_OR_BEYOND);
        int hired     = counts.get(OutreachState.HIRED);

        return new TrackingStats(
                total,
                percent(responded, contacted),
                percent(interest, contacted),
                averageResponseTime(candidates),
                percent(hired, total),
                roleSummaries(candidates));
    }

    /** One summary per role, in first-seen order. */
    public List<RoleSummary> roleSummaries(Collection<TrackedCandidate> candidates) {
        Map<String, List<TrackedCandidate>> byRole = new LinkedHashMap<>();
        for (TrackedCandidate c : candidates) {
            byRole.computeIfAbsent(c.getRoleId(), k -> new ArrayList<>()).add(c);
        }
        return byRole.values().stream()
                .map(this::summarize)
                .toList();
    }

    private RoleSummary summarize(List<TrackedCandidate> roleCandidates) {
        TrackedCandidate first = roleCandidates.get(0);
        Map<OutreachState, Integer> counts = countByStatus(roleCandidates);
        int total = roleCandidates.size();
        int progressed = total - sum(counts, AWAITING);
        int progress = total == 0 ? 0 : Math.round(progressed * 100f / total);
        return new RoleSummary(first.getRoleId(), first.getRoleTitle(), first.getClientName(),
                counts, total, progress);
    }

    private static Map<OutreachState, Integer> countByStatus(Collection<TrackedCandidate> candidates) {
        Map<OutreachState, Integer> counts = new EnumMap<>(OutreachState.class);
        for (OutreachState s : OutreachState.values()) {
            counts.put(s, 0);
        }
        candidates.forEach(c -> counts.merge(c.getStatus(), 1, Integer::sum));
        return counts;
    }

    private static int sum(Map<OutreachState, Integer> counts, Set<OutreachState> states) {
        return states.stream().mapToInt(counts::get).sum();
    }

    private static String percent(int part, int whole) {
        if (whole == 0) {
            return "0.0%";
        }
        return String.format(Locale.ROOT, "%.1f%%", part * 100.0 / whole);
    }

    private static String averageResponseTime(Collection<TrackedCandidate> candidates) {
        OptionalDouble minutes = candidates.stream()
                .filter(c -> c.getResponseAt() != null && c.getLastContactAt() != null)
                .filter(c -> !c.getResponseAt().isBefore(c.getLastContactAt()))
                .mapToLong(c -> Duration.between(c.getLastContactAt(), c.getResponseAt()).toMinutes())
                .average();
        if (minutes.isEmpty()) {
            return "N/A";
        }
        return String.format(Locale.ROOT, "%.1fh", minutes.getAsDouble() / 60.0);
    }
}
