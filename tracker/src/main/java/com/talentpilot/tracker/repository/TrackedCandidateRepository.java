package com.talentpilot.tracker.repository;

import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.TrackedCandidate;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + tracking queries for the tracked_candidates table.
 */
public interface TrackedCandidateRepository extends JpaRepository<TrackedCandidate, UUID> {

    /** All candidates in creation order, which is the order buckets preserve. */
    List<TrackedCandidate> findAllByOrderByCreatedAtAsc();

    List<TrackedCandidate> findByRoleIdOrderByCreatedAtAsc(String roleId);

    /**
     * Load one candidate for a status write.
     *
     * SELECT ... FOR UPDATE: a concurrent write to the same candidate waits
     * here and then sees the committed status, so its transition check runs
     * against fresh state. Must be called inside a @Transactional method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM TrackedCandidate c WHERE c.id = :id")
    Optional<TrackedCandidate> findForUpdateById(@Param("id") UUID id);

    /**
     * CONTACTED candidates whose last send is older than 'cutoff', locked for
     * the no-response sweep.
     *
     * SKIP LOCKED (lock timeout -2): a candidate an operator is writing right
     * now is left for the next sweep instead of being overwritten.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    List<TrackedCandidate> findByStatusAndLastContactAtBefore(OutreachState status, Instant cutoff);
}
