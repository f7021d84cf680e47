package com.talentpilot.tracker.outreach;

import java.util.UUID;

/**
 * Thrown when outbound contact is requested for a candidate with neither
 * an email address nor a phone number on file.
 */
public class MissingContactInfoException extends RuntimeException {

    private final UUID candidateId;

    public MissingContactInfoException(UUID candidateId) {
        super("Candidate " + candidateId + " has no email or phone on file");
        this.candidateId = candidateId;
    }

    public UUID getCandidateId() { return candidateId; }
}
