package com.talentpilot.tracker.outreach;

import com.talentpilot.tracker.model.OutreachEvent;
import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.TrackedCandidate;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static com.talentpilot.tracker.model.OutreachState.*;

/**
 * Single authority for outreach status changes.
 *
 * Transition table (event → allowed from → to):
 * <pre>
 *   CONTACT             PENDING_CONTACT, NO_RESPONSE                      → CONTACTED
 *   MARK_INTERESTED     CONTACTED                                          → INTERESTED
 *   MARK_NOT_INTERESTED CONTACTED, NO_RESPONSE, INTERESTED, SCHEDULED,
 *                       COMPLETED                                          → NOT_INTERESTED
 *   MARK_NO_RESPONSE    CONTACTED                                          → NO_RESPONSE   (system only)
 *   SCHEDULE            INTERESTED                                         → SCHEDULED
 *   COMPLETE            SCHEDULED                                          → COMPLETED
 *   HIRE                COMPLETED                                          → HIRED
 *   REJECT              COMPLETED                                          → NOT_INTERESTED
 * </pre>
 *
 * CONTACT additionally requires the candidate to have an email or a phone.
 * The table itself is stateless and thread-safe; the bulk orchestrator and
 * the tracking store both consult it before writing.
 */
@Component
public class OutreachStateMachine {

    private record Rule(Set<OutreachState> from, OutreachState to) {}

    private static final Map<OutreachEvent, Rule> TABLE = buildTable();

    // ------------------------------------------------------------------
    // State-only queries
    // ------------------------------------------------------------------

    public boolean canTransition(OutreachState current, OutreachEvent event) {
        Objects.requireNonNull(current, "current state");
        Objects.requireNonNull(event, "event");
        return TABLE.get(event).from().contains(current);
    }

    /**
     * @return the resulting state
     * @throws IllegalTransitionException if the table has no row for this move
     */
    public OutreachState apply(OutreachState current, OutreachEvent event) {
        if (!canTransition(current, event)) {
            throw new IllegalTransitionException(current, event);
        }
        return TABLE.get(event).to();
    }

    /** The state an event leads to, regardless of where it is applied from. */
    public OutreachState targetOf(OutreachEvent event) {
        return TABLE.get(Objects.requireNonNull(event, "event")).to();
    }

    // ------------------------------------------------------------------
    // Candidate-aware queries (apply the CONTACT guard)
    // ------------------------------------------------------------------

    public boolean canTransition(TrackedCandidate candidate, OutreachEvent event) {
        if (event == OutreachEvent.CONTACT && candidate.isMissingContact()) {
            return false;
        }
        return canTransition(candidate.getStatus(), event);
    }

    /**
     * @throws MissingContactInfoException on CONTACT for a candidate without email and phone
     * @throws IllegalTransitionException  if the table rejects the move
     */
    public OutreachState apply(TrackedCandidate candidate, OutreachEvent event) {
        if (event == OutreachEvent.CONTACT && candidate.isMissingContact()) {
            throw new MissingContactInfoException(candidate.getId());
        }
        return apply(candidate.getStatus(), event);
    }

    /**
     * Resolve the operator event that moves {@code current} to {@code target}.
     * System-only events are never returned, so NO_RESPONSE is unreachable here.
     */
    public Optional<OutreachEvent> impliedUserEvent(OutreachState current, OutreachState target) {
        Objects.requireNonNull(target, "target state");
        return Arrays.stream(OutreachEvent.values())
                .filter(e -> !e.isSystemOnly())
                .filter(e -> TABLE.get(e).to() == target)
                .filter(e -> canTransition(current, e))
                .findFirst();
    }

    /**
     * Operator actions that are legal for this candidate right now.
     * Presentation code shows exactly these buttons and nothing else.
     */
    public List<OutreachEvent> allowedUserEvents(TrackedCandidate candidate) {
        return Arrays.stream(OutreachEvent.values())
                .filter(e -> !e.isSystemOnly())
                .filter(e -> canTransition(candidate, e))
                .toList();
    }

    // ------------------------------------------------------------------
    // Table
    // ------------------------------------------------------------------

    private static Map<OutreachEvent, Rule> buildTable() {
        Map<OutreachEvent, Rule> t = new EnumMap<>(OutreachEvent.class);
        t.put(OutreachEvent.CONTACT,             rule(CONTACTED,      PENDING_CONTACT, NO_RESPONSE));
        t.put(OutreachEvent.MARK_INTERESTED,     rule(INTERESTED,     CONTACTED));
        t.put(OutreachEvent.MARK_NOT_INTERESTED, rule(NOT_INTERESTED, CONTACTED, NO_RESPONSE, INTERESTED, SCHEDULED, COMPLETED));
        t.put(OutreachEvent.MARK_NO_RESPONSE,    rule(NO_RESPONSE,    CONTACTED));
        t.put(OutreachEvent.SCHEDULE,            rule(SCHEDULED,      INTERESTED));
        t.put(OutreachEvent.COMPLETE,            rule(COMPLETED,      SCHEDULED));
        t.put(OutreachEvent.HIRE,                rule(HIRED,          COMPLETED));
        t.put(OutreachEvent.REJECT,              rule(NOT_INTERESTED, COMPLETED));
        return Collections.unmodifiableMap(t);
    }

    private static Rule rule(OutreachState to, OutreachState first, OutreachState... rest) {
        return new Rule(Collections.unmodifiableSet(EnumSet.of(first, rest)), to);
    }
}
