package com.talentpilot.tracker.bulk;

/**
 * One failed candidate inside a batch.
 *
 * @param candidateId the id exactly as the caller sent it, so the failed
 *                    subset can be resubmitted as-is
 * @param reason      machine-readable code; for channel errors this is the
 *                    dispatch service's own reason, passed through verbatim
 * @param kind        failure category, which decides the recovery action
 */
public record BulkActionError(String candidateId, String reason, FailureKind kind) {

    public static BulkActionError of(String candidateId, FailureKind kind) {
        return new BulkActionError(candidateId, kind.code(), kind);
    }

    public static BulkActionError of(String candidateId, FailureKind kind, String reason) {
        String r = (reason == null || reason.isBlank()) ? kind.code() : reason;
        return new BulkActionError(candidateId, r, kind);
    }

    public FailureKind.Recovery recovery() {
        return kind.recovery();
    }
}
