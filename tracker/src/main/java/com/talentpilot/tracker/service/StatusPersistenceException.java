package com.talentpilot.tracker.service;

import java.util.UUID;

/**
 * The status store could not write a change.
 *
 * When raised after a successful send, the candidate was contacted but
 * still shows the old status: the fix is a status repair, not a resend.
 */
public class StatusPersistenceException extends RuntimeException {

    private final UUID candidateId;

    public StatusPersistenceException(UUID candidateId, String message, Throwable cause) {
        super(message, cause);
        this.candidateId = candidateId;
    }

    public UUID getCandidateId() { return candidateId; }
}
