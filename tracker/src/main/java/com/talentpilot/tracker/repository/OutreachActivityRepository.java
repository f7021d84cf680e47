package com.talentpilot.tracker.repository;

import com.talentpilot.tracker.model.OutreachActivity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Append-only access to the outreach_activity feed.
 */
public interface OutreachActivityRepository extends JpaRepository<OutreachActivity, UUID> {

    /** Newest first; the page size caps the feed. */
    List<OutreachActivity> findAllByOrderByCreatedAtDesc(Pageable page);
}
