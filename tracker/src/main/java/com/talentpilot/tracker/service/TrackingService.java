package com.talentpilot.tracker.service;

import com.talentpilot.tracker.grouping.CandidateGroupingIndex;
import com.talentpilot.tracker.model.ActivityType;
import com.talentpilot.tracker.model.ContactChannel;
import com.talentpilot.tracker.model.OutreachActivity;
import com.talentpilot.tracker.model.OutreachEvent;
import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.TrackedCandidate;
import com.talentpilot.tracker.outreach.IllegalTransitionException;
import com.talentpilot.tracker.outreach.OutreachStateMachine;
import com.talentpilot.tracker.repository.OutreachActivityRepository;
import com.talentpilot.tracker.repository.TrackedCandidateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Authoritative store for outreach status.
 *
 * Every write re-validates the move against {@link OutreachStateMachine},
 * even when the caller already checked: two batches touching the same
 * candidate can race, and the store is the last line before the database.
 * Each successful write appends an entry to the activity feed.
 */
@Service
public class TrackingService {

    private static final Logger log = LoggerFactory.getLogger(TrackingService.class);

    // Moves out of these states count as the candidate answering.
    private static final Set<OutreachState> AWAITING_REPLY =
            EnumSet.of(OutreachState.CONTACTED, OutreachState.NO_RESPONSE);

    private final TrackedCandidateRepository candidateRepo;
    private final OutreachActivityRepository activityRepo;
    private final OutreachStateMachine       stateMachine;
    private final CandidateGroupingIndex     groupingIndex;
    private final Clock                      clock;

    public TrackingService(TrackedCandidateRepository candidateRepo,
                           OutreachActivityRepository activityRepo,
                           OutreachStateMachine stateMachine,
                           CandidateGroupingIndex groupingIndex,
                           Clock clock) {
        this.candidateRepo = candidateRepo;
        this.activityRepo  = activityRepo;
        this.stateMachine  = stateMachine;
        this.groupingIndex = groupingIndex;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<TrackedCandidate> findById(UUID id) {
        return candidateRepo.findById(id);
    }

    /** Candidates keyed by id; ids that are not tracked are simply absent. */
    @Transactional(readOnly = true)
    public Map<UUID, TrackedCandidate> findAllById(Collection<UUID> ids) {
        Map<UUID, TrackedCandidate> byId = new HashMap<>();
        for (TrackedCandidate c : candidateRepo.findAllById(ids)) {
            byId.put(c.getId(), c);
        }
        return byId;
    }

    /** All candidates, or those of one role when {@code roleId} is given. */
    @Transactional(readOnly = true)
    public List<TrackedCandidate> findCandidates(String roleId) {
        return (roleId == null || roleId.isBlank())
                ? candidateRepo.findAllByOrderByCreatedAtAsc()
                : candidateRepo.findByRoleIdOrderByCreatedAtAsc(roleId);
    }

    @Transactional(readOnly = true)
    public TrackingSnapshot fetchTracking(String roleId) {
        List<TrackedCandidate> candidates = findCandidates(roleId);
        return new TrackingSnapshot(groupingIndex.groupByStatus(candidates), candidates.size());
    }

    @Transactional(readOnly = true)
    public List<OutreachActivity> recentActivity(int limit) {
        int size = Math.max(1, Math.min(limit, 200));
        return activityRepo.findAllByOrderByCreatedAtDesc(PageRequest.of(0, size));
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Record a successful send: CONTACT transition, last_contact_at reset,
     * channel remembered for later resends.
     *
     * @param reminder true when this was a resend to a NO_RESPONSE candidate
     * @throws IllegalTransitionException  if the candidate moved since the caller checked
     * @throws StatusPersistenceException  if the write fails
     */
    @Transactional
    public TrackedCandidate recordContact(UUID id, ContactChannel channel, boolean reminder,
                                          String message, String actor) {
        TrackedCandidate c = load(id);
        OutreachState previous = c.getStatus();
        OutreachState next = stateMachine.apply(c, OutreachEvent.CONTACT);

        c.setStatus(next);
        c.setLastContactAt(clock.instant());
        c.setLastContactChannel(channel);
        ActivityType type = reminder ? ActivityType.REMINDER_SENT : ActivityType.MESSAGE_SENT;
        String detail = channel.wireName() + (message == null || message.isBlank() ? "" : ": " + message);
        return persist(c, new OutreachActivity(type, c, detail, previous, next, actor));
    }

    /**
     * Operator status change through the transition table. CONTACTED is
     * only reachable by recording an actual send ({@link #recordContact}).
     *
     * @throws IllegalTransitionException if no operator event leads from the current state to {@code target}
     */
    @Transactional
    public TrackedCandidate updateStatus(UUID id, OutreachState target, String notes, String actor) {
        TrackedCandidate c = load(id);
        OutreachState previous = c.getStatus();
        OutreachEvent event = stateMachine.impliedUserEvent(previous, target)
                .filter(e -> e != OutreachEvent.CONTACT)
                .orElseThrow(() -> new IllegalTransitionException(previous, target));
        OutreachState next = stateMachine.apply(c, event);

        c.setStatus(next);
        if (AWAITING_REPLY.contains(previous) && c.getResponseAt() == null) {
            c.setResponseAt(clock.instant());
        }
        appendNote(c, notes, actor);
        return persist(c, new OutreachActivity(ActivityType.STATUS_CHANGED, c, notes, previous, next, actor));
    }

    /**
     * Operator override that sets any status, bypassing the transition table.
     * Kept separate from {@link #updateStatus} so call sites have to ask for it.
     * NO_RESPONSE still requires a previous contact.
     */
    @Transactional
    public TrackedCandidate forceStatus(UUID id, OutreachState target, String notes, String actor) {
        TrackedCandidate c = load(id);
        OutreachState previous = c.getStatus();
        if (target == OutreachState.NO_RESPONSE && c.getLastContactAt() == null) {
            throw new IllegalTransitionException(previous, target);
        }
        log.warn("Status override for candidate {}: {} → {} by {}", id, previous, target, actor);

        c.setStatus(target);
        appendNote(c, "[override " + previous.wireName() + " → " + target.wireName() + "]"
                + (notes == null || notes.isBlank() ? "" : " " + notes), actor);
        return persist(c, new OutreachActivity(ActivityType.STATUS_CHANGED, c,
                "override" + (notes == null ? "" : ": " + notes), previous, target, actor));
    }

    @Transactional
    public TrackedCandidate addNote(UUID id, String note, String actor) {
        TrackedCandidate c = load(id);
        appendNote(c, note, actor);
        return persist(c, new OutreachActivity(ActivityType.NOTE_ADDED, c, note, c.getStatus(), c.getStatus(), actor));
    }

    /**
     * Move CONTACTED candidates whose last send is older than {@code cutoff}
     * to NO_RESPONSE. Rows locked by a concurrent write are skipped by the
     * query and picked up by a later sweep.
     *
     * @return number of candidates moved
     */
    @Transactional
    public int markNoResponse(Instant cutoff) {
        List<TrackedCandidate> stale =
                candidateRepo.findByStatusAndLastContactAtBefore(OutreachState.CONTACTED, cutoff);
        int moved = 0;
        for (TrackedCandidate c : stale) {
            if (!stateMachine.canTransition(c, OutreachEvent.MARK_NO_RESPONSE)) {
                continue;
            }
            OutreachState previous = c.getStatus();
            c.setStatus(stateMachine.apply(c, OutreachEvent.MARK_NO_RESPONSE));
            persist(c, new OutreachActivity(ActivityType.STATUS_CHANGED, c,
                    "no reply since " + c.getLastContactAt(), previous, c.getStatus(), "system"));
            moved++;
        }
        return moved;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Row-locked read; every write goes through here. */
    private TrackedCandidate load(UUID id) {
        return candidateRepo.findForUpdateById(id)
                .orElseThrow(() -> new CandidateNotFoundException(id.toString()));
    }

    /**
     * saveAndFlush so constraint and connection errors surface here as a
     * StatusPersistenceException rather than at commit time.
     */
    private TrackedCandidate persist(TrackedCandidate c, OutreachActivity activity) {
        try {
            TrackedCandidate saved = candidateRepo.saveAndFlush(c);
            activityRepo.save(activity);
            return saved;
        } catch (DataAccessException e) {
            throw new StatusPersistenceException(c.getId(),
                    "Status write failed for candidate " + c.getId() + ": " + e.getMessage(), e);
        }
    }

    private void appendNote(TrackedCandidate c, String note, String actor) {
        if (note == null || note.isBlank()) {
            return;
        }
        String line = "[" + clock.instant() + "] " + actor + ": " + note.strip();
        String existing = c.getNotes();
        c.setNotes(existing == null || existing.isBlank() ? line : existing + "\n" + line);
    }
}
