package com.talentpilot.tracker.grouping;

import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.TrackedCandidate;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.talentpilot.tracker.model.CandidateFixtures.candidate;
import static com.talentpilot.tracker.model.CandidateFixtures.createdAt;
import static com.talentpilot.tracker.model.CandidateFixtures.noResponse;
import static com.talentpilot.tracker.model.CandidateFixtures.withoutContact;
import static com.talentpilot.tracker.model.OutreachState.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateGroupingIndexTest {

    private final CandidateGroupingIndex index = new CandidateGroupingIndex();

    // ------------------------------------------------------------------
    // groupByStatus
    // ------------------------------------------------------------------

    @Test
    void groupByStatus_everyCandidateInExactlyOneBucket() {
        List<TrackedCandidate> all = new ArrayList<>();
        OutreachState[] states = OutreachState.values();
        for (int i = 0; i < 25; i++) {
            all.add(candidate(states[i % 3 == 0 ? 0 : i % states.length]));
        }

        Map<OutreachState, List<TrackedCandidate>> buckets = index.groupByStatus(all);

        assertThat(buckets.keySet()).containsExactlyInAnyOrder(states);
        int total = buckets.values().stream().mapToInt(List::size).sum();
        assertThat(total).isEqualTo(all.size());
        Set<TrackedCandidate> seen = new HashSet<>();
        buckets.values().forEach(b -> b.forEach(c -> assertThat(seen.add(c)).isTrue()));
    }

    @Test
    void groupByStatus_emptyInput_allKeysPresentAndEmpty() {
        Map<OutreachState, List<TrackedCandidate>> buckets = index.groupByStatus(List.of());

        assertThat(buckets).hasSize(OutreachState.values().length);
        assertThat(buckets.values()).allMatch(List::isEmpty);
    }

    @Test
    void groupByStatus_keepsInsertionOrderPerBucket() {
        TrackedCandidate a = candidate(CONTACTED);
        TrackedCandidate b = candidate(INTERESTED);
        TrackedCandidate c = candidate(CONTACTED);

        assertThat(index.groupByStatus(List.of(a, b, c)).get(CONTACTED)).containsExactly(a, c);
    }

    // ------------------------------------------------------------------
    // applyFilters
    // ------------------------------------------------------------------

    @Test
    void applyFilters_statusIsOrAndSearchIsAnd() {
        TrackedCandidate ana   = candidate("Ana", "Pérez", "ana@acme.io", null, CONTACTED);
        TrackedCandidate anita = candidate("Anita", "Lopez", "anita@foo.io", null, INTERESTED);
        TrackedCandidate bruno = candidate("Bruno", "Díaz", "bruno@acme.io", null, CONTACTED);
        List<TrackedCandidate> all = List.of(ana, anita, bruno);

        assertThat(index.applyFilters(all, new TrackingFilters(Set.of(CONTACTED, INTERESTED), null)))
                .containsExactly(ana, anita, bruno);
        assertThat(index.applyFilters(all, new TrackingFilters(Set.of(CONTACTED), "ANA")))
                .containsExactly(ana);
        assertThat(index.applyFilters(all, new TrackingFilters(null, "acme.io")))
                .containsExactly(ana, bruno);
        assertThat(index.applyFilters(all, new TrackingFilters(null, "ana pérez")))
                .containsExactly(ana);
    }

    @Test
    void applyFilters_noFilters_returnsEverythingWithoutMutatingInput() {
        List<TrackedCandidate> all = new ArrayList<>(List.of(candidate(CONTACTED), withoutContact(PENDING_CONTACT)));
        List<TrackedCandidate> copy = List.copyOf(all);

        assertThat(index.applyFilters(all, TrackingFilters.none())).containsExactlyElementsOf(copy);
        assertThat(all).containsExactlyElementsOf(copy);
    }

    @Test
    void applyFilters_searchSkipsCandidatesWithoutEmail() {
        TrackedCandidate noEmail = withoutContact(PENDING_CONTACT);

        assertThat(index.applyFilters(List.of(noEmail), new TrackingFilters(null, "example.com"))).isEmpty();
    }

    // ------------------------------------------------------------------
    // resendEligible
    // ------------------------------------------------------------------

    @Test
    void applyFilters_createdDateRange_inclusiveOnBothEnds() {
        Instant from = Instant.parse("2026-03-01T00:00:00Z");
        Instant to = Instant.parse("2026-03-31T23:59:59Z");
        TrackedCandidate before = createdAt(candidate(CONTACTED), from.minusSeconds(1));
        TrackedCandidate onFrom = createdAt(candidate(CONTACTED), from);
        TrackedCandidate inside = createdAt(candidate(CONTACTED), Instant.parse("2026-03-15T10:00:00Z"));
        TrackedCandidate onTo = createdAt(candidate(CONTACTED), to);
        TrackedCandidate after = createdAt(candidate(CONTACTED), to.plusSeconds(1));
        List<TrackedCandidate> all = List.of(before, onFrom, inside, onTo, after);

        assertThat(index.applyFilters(all, new TrackingFilters(null, null, from, to, null)))
                .containsExactly(onFrom, inside, onTo);
        assertThat(index.applyFilters(all, new TrackingFilters(null, null, from, null, null)))
                .containsExactly(onFrom, inside, onTo, after);
        assertThat(index.applyFilters(all, new TrackingFilters(null, null, null, to, null)))
                .containsExactly(before, onFrom, inside, onTo);
    }

    @Test
    void applyFilters_hasResponse_trueFalseOrEither() {
        TrackedCandidate replied = candidate(INTERESTED);
        replied.setResponseAt(Instant.parse("2026-03-05T09:00:00Z"));
        TrackedCandidate silent = candidate(CONTACTED);
        List<TrackedCandidate> all = List.of(replied, silent);

        assertThat(index.applyFilters(all, new TrackingFilters(null, null, null, null, true)))
                .containsExactly(replied);
        assertThat(index.applyFilters(all, new TrackingFilters(null, null, null, null, false)))
                .containsExactly(silent);
        assertThat(index.applyFilters(all, new TrackingFilters(null, null, null, null, null)))
                .containsExactly(replied, silent);
    }

    @Test
    void applyFilters_allFieldsAreAnded() {
        Instant march = Instant.parse("2026-03-10T00:00:00Z");
        TrackedCandidate match = createdAt(candidate("Bruno", "Díaz", "bruno@acme.io", null, INTERESTED), march);
        match.setResponseAt(march.plusSeconds(3600));
        TrackedCandidate wrongStatus = createdAt(candidate("Bruno", "Sanz", "bs@acme.io", null, HIRED), march);
        wrongStatus.setResponseAt(march.plusSeconds(3600));
        TrackedCandidate noReply = createdAt(candidate("Bruno", "Ruiz", "br@acme.io", null, INTERESTED), march);
        TrackedCandidate tooOld = createdAt(candidate("Bruno", "Gil", "bg@acme.io", null, INTERESTED),
                march.minusSeconds(30L * 86_400));
        tooOld.setResponseAt(march);

        TrackingFilters filters = new TrackingFilters(Set.of(INTERESTED), "bruno",
                Instant.parse("2026-03-01T00:00:00Z"), null, true);

        assertThat(index.applyFilters(List.of(match, wrongStatus, noReply, tooOld), filters))
                .containsExactly(match);
    }

    @Test
    void trackingFilters_invertedDateRange_rejected() {
        Instant from = Instant.parse("2026-03-10T00:00:00Z");

        assertThatThrownBy(() -> new TrackingFilters(null, null, from, from.minusSeconds(1), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resendEligible_honoursThreshold() {
        Instant now = Instant.parse("2026-03-10T12:00:00Z");
        TrackedCandidate oneDay   = noResponse(1, now);
        TrackedCandidate threeDay = noResponse(3, now);
        TrackedCandidate contacted = candidate(CONTACTED);

        assertThat(index.resendEligible(List.of(oneDay, threeDay, contacted), 2, now))
                .containsExactly(threeDay);
        assertThat(threeDay.daysWithoutResponse(now)).isEqualTo(3);
        assertThat(contacted.daysWithoutResponse(now)).isNull();
    }
}
