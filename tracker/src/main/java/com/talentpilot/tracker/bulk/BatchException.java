package com.talentpilot.tracker.bulk;

import java.util.Collection;
import java.util.List;

/**
 * The whole batch could not start (store unreachable, batch rejected),
 * so no candidate was attempted. Distinct from a batch in which zero
 * candidates matched, which is an ordinary result.
 */
public class BatchException extends RuntimeException {

    public static final String STORE_UNAVAILABLE = "store_unavailable";
    public static final String BATCH_TOO_LARGE   = "batch_too_large";

    private final BulkOperation operation;
    private final List<String>  candidateIds;
    private final String        reason;

    public BatchException(BulkOperation operation, Collection<String> candidateIds, String reason,
                          String message, Throwable cause) {
        super(message, cause);
        this.operation    = operation;
        this.candidateIds = List.copyOf(candidateIds);
        this.reason       = reason;
    }

    public BulkOperation getOperation() { return operation; }
    public List<String>  getCandidateIds() { return candidateIds; }
    public String        getReason()    { return reason; }
}
