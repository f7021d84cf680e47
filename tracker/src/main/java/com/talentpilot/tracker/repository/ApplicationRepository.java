package com.talentpilot.tracker.repository;

import com.talentpilot.tracker.model.Application;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * CRUD for the applications table. Transitions are cascaded from the parent.
 */
public interface ApplicationRepository extends JpaRepository<Application, UUID> {

    /** Loads the transition history eagerly; timelines are rendered outside the transaction. */
    @EntityGraph(attributePaths = "transitions")
    Optional<Application> findWithTransitionsById(UUID id);

    /**
     * Row-locked load for a stage move, so two moves on one application are
     * checked one after the other. Must be called inside a @Transactional method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Application a WHERE a.id = :id")
    Optional<Application> findForUpdateById(@Param("id") UUID id);
}
