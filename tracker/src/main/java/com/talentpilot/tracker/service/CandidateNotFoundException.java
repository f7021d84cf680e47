package com.talentpilot.tracker.service;

/**
 * Thrown by single-candidate operations when the id is not tracked.
 */
public class CandidateNotFoundException extends RuntimeException {

    private final String candidateId;

    public CandidateNotFoundException(String candidateId) {
        super("Tracked candidate not found: " + candidateId);
        this.candidateId = candidateId;
    }

    public String getCandidateId() { return candidateId; }
}
