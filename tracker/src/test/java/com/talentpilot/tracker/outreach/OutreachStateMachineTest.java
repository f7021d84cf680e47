package com.talentpilot.tracker.outreach;

import com.talentpilot.tracker.model.OutreachEvent;
import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.TrackedCandidate;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.talentpilot.tracker.model.CandidateFixtures.candidate;
import static com.talentpilot.tracker.model.CandidateFixtures.withoutContact;
import static com.talentpilot.tracker.model.OutreachState.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for OutreachStateMachine. No Spring context.
 */
class OutreachStateMachineTest {

    private final OutreachStateMachine machine = new OutreachStateMachine();

    /** The legal table, written out independently of the implementation. */
    private static final Map<OutreachEvent, Set<OutreachState>> LEGAL = new EnumMap<>(Map.of(
            OutreachEvent.CONTACT,             EnumSet.of(PENDING_CONTACT, NO_RESPONSE),
            OutreachEvent.MARK_INTERESTED,     EnumSet.of(CONTACTED),
            OutreachEvent.MARK_NOT_INTERESTED, EnumSet.of(CONTACTED, NO_RESPONSE, INTERESTED, SCHEDULED, COMPLETED),
            OutreachEvent.MARK_NO_RESPONSE,    EnumSet.of(CONTACTED),
            OutreachEvent.SCHEDULE,            EnumSet.of(INTERESTED),
            OutreachEvent.COMPLETE,            EnumSet.of(SCHEDULED),
            OutreachEvent.HIRE,                EnumSet.of(COMPLETED),
            OutreachEvent.REJECT,              EnumSet.of(COMPLETED)));

    // ------------------------------------------------------------------
    // Table
    // ------------------------------------------------------------------

    @Test
    void everyPairOutsideTable_isRejected() {
        for (OutreachEvent event : OutreachEvent.values()) {
            for (OutreachState state : OutreachState.values()) {
                boolean legal = LEGAL.get(event).contains(state);
                assertThat(machine.canTransition(state, event))
                        .as("%s from %s", event, state)
                        .isEqualTo(legal);
                if (!legal) {
                    assertThatThrownBy(() -> machine.apply(state, event))
                            .isInstanceOf(IllegalTransitionException.class)
                            .satisfies(e -> {
                                IllegalTransitionException ite = (IllegalTransitionException) e;
                                assertThat(ite.getCurrent()).isEqualTo(state);
                                assertThat(ite.getEvent()).isEqualTo(event);
                            });
                }
            }
        }
    }

    @Test
    void apply_legalMoves_reachExpectedState() {
        assertThat(machine.apply(PENDING_CONTACT, OutreachEvent.CONTACT)).isEqualTo(CONTACTED);
        assertThat(machine.apply(NO_RESPONSE, OutreachEvent.CONTACT)).isEqualTo(CONTACTED);
        assertThat(machine.apply(CONTACTED, OutreachEvent.MARK_NO_RESPONSE)).isEqualTo(NO_RESPONSE);
        assertThat(machine.apply(COMPLETED, OutreachEvent.HIRE)).isEqualTo(HIRED);
        assertThat(machine.apply(COMPLETED, OutreachEvent.REJECT)).isEqualTo(NOT_INTERESTED);
    }

    @Test
    void terminalStates_haveNoOutgoingEvents() {
        for (OutreachEvent event : OutreachEvent.values()) {
            assertThat(machine.canTransition(HIRED, event)).isFalse();
            assertThat(machine.canTransition(NOT_INTERESTED, event)).isFalse();
        }
    }

    @Test
    void nullState_failsLoudly() {
        assertThatThrownBy(() -> machine.canTransition((OutreachState) null, OutreachEvent.CONTACT))
                .isInstanceOf(NullPointerException.class);
    }

    // ------------------------------------------------------------------
    // Contact guard
    // ------------------------------------------------------------------

    @Test
    void contact_candidateWithoutEmailOrPhone_throwsMissingContactInfo() {
        TrackedCandidate c = withoutContact(PENDING_CONTACT);

        assertThat(machine.canTransition(c, OutreachEvent.CONTACT)).isFalse();
        assertThatThrownBy(() -> machine.apply(c, OutreachEvent.CONTACT))
                .isInstanceOf(MissingContactInfoException.class);
    }

    @Test
    void contact_phoneOnly_isAllowed() {
        TrackedCandidate c = candidate("Ana", "Pérez", null, "+34600000000", PENDING_CONTACT);

        assertThat(c.isMissingContact()).isFalse();
        assertThat(machine.apply(c, OutreachEvent.CONTACT)).isEqualTo(CONTACTED);
    }

    @Test
    void missingContact_isRecomputedWhenContactChanges() {
        TrackedCandidate c = withoutContact(PENDING_CONTACT);
        assertThat(c.isMissingContact()).isTrue();

        c.setEmail("luis@example.com");
        assertThat(c.isMissingContact()).isFalse();

        c.setEmail("  ");
        assertThat(c.isMissingContact()).isTrue();
    }

    // ------------------------------------------------------------------
    // Operator queries
    // ------------------------------------------------------------------

    @Test
    void impliedUserEvent_pendingToHired_isEmpty() {
        assertThat(machine.impliedUserEvent(PENDING_CONTACT, HIRED)).isEmpty();
    }

    @Test
    void impliedUserEvent_neverReturnsSystemOnlyEvent() {
        assertThat(machine.impliedUserEvent(CONTACTED, NO_RESPONSE)).isEmpty();
    }

    @Test
    void impliedUserEvent_completedToNotInterested_resolvesAnEvent() {
        assertThat(machine.impliedUserEvent(COMPLETED, NOT_INTERESTED)).isPresent();
        assertThat(machine.impliedUserEvent(INTERESTED, SCHEDULED)).contains(OutreachEvent.SCHEDULE);
    }

    @Test
    void allowedUserEvents_contacted_excludesNoResponse() {
        assertThat(machine.allowedUserEvents(candidate(CONTACTED)))
                .containsExactly(OutreachEvent.MARK_INTERESTED, OutreachEvent.MARK_NOT_INTERESTED);
    }

    @Test
    void allowedUserEvents_missingContact_excludesContact() {
        assertThat(machine.allowedUserEvents(withoutContact(NO_RESPONSE)))
                .containsExactly(OutreachEvent.MARK_NOT_INTERESTED);
    }
}
