package com.talentpilot.tracker.service;

import com.talentpilot.tracker.grouping.CandidateGroupingIndex;
import com.talentpilot.tracker.model.ActivityType;
import com.talentpilot.tracker.model.ContactChannel;
import com.talentpilot.tracker.model.OutreachActivity;
import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.TrackedCandidate;
import com.talentpilot.tracker.outreach.IllegalTransitionException;
import com.talentpilot.tracker.outreach.MissingContactInfoException;
import com.talentpilot.tracker.outreach.OutreachStateMachine;
import com.talentpilot.tracker.repository.OutreachActivityRepository;
import com.talentpilot.tracker.repository.TrackedCandidateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.talentpilot.tracker.model.CandidateFixtures.candidate;
import static com.talentpilot.tracker.model.CandidateFixtures.noResponse;
import static com.talentpilot.tracker.model.CandidateFixtures.withoutContact;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TrackingService. Repositories are mocked; the state
 * machine is the real one.
 */
@ExtendWith(MockitoExtension.class)
class TrackingServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @Mock TrackedCandidateRepository candidateRepo;
    @Mock OutreachActivityRepository activityRepo;

    TrackingService service;

    @BeforeEach
    void setUp() {
        service = new TrackingService(candidateRepo, activityRepo, new OutreachStateMachine(),
                new CandidateGroupingIndex(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ------------------------------------------------------------------
    // recordContact()
    // ------------------------------------------------------------------

    @Test
    void recordContact_pending_movesToContactedAndLogsActivity() {
        TrackedCandidate c = stored(candidate(OutreachState.PENDING_CONTACT));

        service.recordContact(c.getId(), ContactChannel.EMAIL, false, "hola", "maria");

        assertThat(c.getStatus()).isEqualTo(OutreachState.CONTACTED);
        assertThat(c.getLastContactAt()).isEqualTo(NOW);
        assertThat(c.getLastContactChannel()).isEqualTo(ContactChannel.EMAIL);
        ArgumentCaptor<OutreachActivity> activity = ArgumentCaptor.forClass(OutreachActivity.class);
        verify(activityRepo).save(activity.capture());
        assertThat(activity.getValue().getType()).isEqualTo(ActivityType.MESSAGE_SENT);
        assertThat(activity.getValue().getPreviousStatus()).isEqualTo(OutreachState.PENDING_CONTACT);
        assertThat(activity.getValue().getCreatedBy()).isEqualTo("maria");
    }

    @Test
    void recordContact_reminder_resetsLastContactAndClearsDaysWithoutResponse() {
        TrackedCandidate c = stored(noResponse(3, NOW));
        assertThat(c.daysWithoutResponse(NOW)).isEqualTo(3);

        service.recordContact(c.getId(), ContactChannel.EMAIL, true, null, "system");

        assertThat(c.getStatus()).isEqualTo(OutreachState.CONTACTED);
        assertThat(c.getLastContactAt()).isEqualTo(NOW);
        assertThat(c.daysWithoutResponse(NOW)).isNull();
    }

    @Test
    void recordContact_candidateMovedMeanwhile_rejected() {
        TrackedCandidate c = candidate(OutreachState.INTERESTED);
        when(candidateRepo.findForUpdateById(c.getId())).thenReturn(Optional.of(c));

        assertThatThrownBy(() -> service.recordContact(c.getId(), ContactChannel.EMAIL, false, null, "system"))
                .isInstanceOf(IllegalTransitionException.class);
        verify(candidateRepo, never()).saveAndFlush(any());
    }

    @Test
    void recordContact_missingContact_rejected() {
        TrackedCandidate c = withoutContact(OutreachState.PENDING_CONTACT);
        when(candidateRepo.findForUpdateById(c.getId())).thenReturn(Optional.of(c));

        assertThatThrownBy(() -> service.recordContact(c.getId(), ContactChannel.EMAIL, false, null, "system"))
                .isInstanceOf(MissingContactInfoException.class);
    }

    @Test
    void recordContact_writeFails_wrappedAsPersistenceError() {
        TrackedCandidate c = candidate(OutreachState.PENDING_CONTACT);
        when(candidateRepo.findForUpdateById(c.getId())).thenReturn(Optional.of(c));
        when(candidateRepo.saveAndFlush(c)).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> service.recordContact(c.getId(), ContactChannel.EMAIL, false, null, "system"))
                .isInstanceOf(StatusPersistenceException.class)
                .hasMessageContaining("db down");
    }

    // ------------------------------------------------------------------
    // updateStatus() / forceStatus() / addNote()
    // ------------------------------------------------------------------

    @Test
    void updateStatus_pendingToHired_illegal() {
        TrackedCandidate c = candidate(OutreachState.PENDING_CONTACT);
        when(candidateRepo.findForUpdateById(c.getId())).thenReturn(Optional.of(c));

        assertThatThrownBy(() -> service.updateStatus(c.getId(), OutreachState.HIRED, null, "maria"))
                .isInstanceOf(IllegalTransitionException.class);
        assertThat(c.getStatus()).isEqualTo(OutreachState.PENDING_CONTACT);
    }

    @Test
    void updateStatus_contactedToInterested_setsResponseAtAndAppendsNote() {
        TrackedCandidate c = stored(candidate(OutreachState.CONTACTED));

        service.updateStatus(c.getId(), OutreachState.INTERESTED, "replied on LinkedIn", "maria");

        assertThat(c.getStatus()).isEqualTo(OutreachState.INTERESTED);
        assertThat(c.getResponseAt()).isEqualTo(NOW);
        assertThat(c.getNotes()).isEqualTo("[" + NOW + "] maria: replied on LinkedIn");
    }

    @Test
    void updateStatus_toContacted_rejectedBecauseNothingWasSent() {
        TrackedCandidate c = candidate(OutreachState.PENDING_CONTACT);
        when(candidateRepo.findForUpdateById(c.getId())).thenReturn(Optional.of(c));

        assertThatThrownBy(() -> service.updateStatus(c.getId(), OutreachState.CONTACTED, null, "maria"))
                .isInstanceOf(IllegalTransitionException.class);
        assertThat(c.getStatus()).isEqualTo(OutreachState.PENDING_CONTACT);
        assertThat(c.getLastContactAt()).isNull();
        verify(candidateRepo, never()).saveAndFlush(any());
    }

    @Test
    void updateStatus_checksStatusReadUnderRowLock() {
        // The caller saw CONTACTED; the sweep committed NO_RESPONSE before the lock was granted.
        TrackedCandidate current = candidate(OutreachState.NO_RESPONSE);
        current.setLastContactAt(NOW.minusSeconds(72 * 3600));
        when(candidateRepo.findForUpdateById(current.getId())).thenReturn(Optional.of(current));

        assertThatThrownBy(() -> service.updateStatus(current.getId(), OutreachState.INTERESTED, null, "maria"))
                .isInstanceOf(IllegalTransitionException.class);
        verify(candidateRepo, never()).findById(any());
        verify(candidateRepo, never()).saveAndFlush(any());
    }

    @Test
    void forceStatus_bypassesTableAndMarksOverride() {
        TrackedCandidate c = stored(candidate(OutreachState.PENDING_CONTACT));

        service.forceStatus(c.getId(), OutreachState.HIRED, "placed directly", "admin");

        assertThat(c.getStatus()).isEqualTo(OutreachState.HIRED);
        assertThat(c.getNotes()).contains("[override pending_contact → hired]").contains("placed directly");
    }

    @Test
    void forceStatus_noResponseWithoutPreviousContact_rejected() {
        TrackedCandidate c = candidate(OutreachState.PENDING_CONTACT);
        when(candidateRepo.findForUpdateById(c.getId())).thenReturn(Optional.of(c));

        assertThatThrownBy(() -> service.forceStatus(c.getId(), OutreachState.NO_RESPONSE, null, "admin"))
                .isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    void addNote_appendsToExistingNotes() {
        TrackedCandidate c = stored(candidate(OutreachState.CONTACTED));
        c.setNotes("first");

        service.addNote(c.getId(), "  second  ", "maria");

        assertThat(c.getNotes()).isEqualTo("first\n[" + NOW + "] maria: second");
        assertThat(c.getStatus()).isEqualTo(OutreachState.CONTACTED);
    }

    @Test
    void addNote_unknownCandidate_notFound() {
        UUID id = UUID.randomUUID();
        when(candidateRepo.findForUpdateById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.addNote(id, "x", "maria"))
                .isInstanceOf(CandidateNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // markNoResponse() / fetchTracking()
    // ------------------------------------------------------------------

    @Test
    void markNoResponse_movesStaleContactedCandidates() {
        TrackedCandidate stale = candidate(OutreachState.CONTACTED);
        stale.setLastContactAt(NOW.minusSeconds(72 * 3600));
        Instant cutoff = NOW.minusSeconds(48 * 3600);
        when(candidateRepo.findByStatusAndLastContactAtBefore(OutreachState.CONTACTED, cutoff))
                .thenReturn(List.of(stale));
        when(candidateRepo.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        int moved = service.markNoResponse(cutoff);

        assertThat(moved).isEqualTo(1);
        assertThat(stale.getStatus()).isEqualTo(OutreachState.NO_RESPONSE);
        assertThat(stale.daysWithoutResponse(NOW)).isEqualTo(3);
    }

    @Test
    void fetchTracking_groupsAllStatusesAndCounts() {
        when(candidateRepo.findByRoleIdOrderByCreatedAtAsc("role-1")).thenReturn(List.of(
                candidate(OutreachState.CONTACTED), candidate(OutreachState.CONTACTED), candidate(OutreachState.HIRED)));

        TrackingSnapshot snapshot = service.fetchTracking("role-1");

        assertThat(snapshot.total()).isEqualTo(3);
        assertThat(snapshot.byStatus()).hasSize(OutreachState.values().length);
        assertThat(snapshot.byStatus().get(OutreachState.CONTACTED)).hasSize(2);
        assertThat(snapshot.byStatus().get(OutreachState.NO_RESPONSE)).isEmpty();
    }

    private TrackedCandidate stored(TrackedCandidate c) {
        when(candidateRepo.findForUpdateById(c.getId())).thenReturn(Optional.of(c));
        when(candidateRepo.saveAndFlush(c)).thenReturn(c);
        return c;
    }
}
