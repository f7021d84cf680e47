package com.talentpilot.tracker.bulk;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate outcome of one bulk operation.
 *
 * processed + failed equals the number of distinct ids submitted; ids that
 * are not tracked are counted as failed with {@code not_found}. Error order
 * carries no meaning. A batch that never started has a single
 * {@code batch_error} entry instead of one entry per id.
 */
public record BulkActionResult(int processed, int failed, List<BulkActionError> errors) {

    public BulkActionResult {
        errors = List.copyOf(errors);
    }

    public boolean success() {
        return failed == 0;
    }

    public int attempted() {
        return processed + failed;
    }

    /** Ids to resubmit; already-processed candidates are never included. */
    public List<String> failedIds() {
        return errors.stream()
                .map(BulkActionError::candidateId)
                .filter(Objects::nonNull)
                .toList();
    }

    public List<BulkActionError> errorsOfKind(FailureKind kind) {
        return errors.stream().filter(e -> e.kind() == kind).toList();
    }

    public static BulkActionResult empty() {
        return new BulkActionResult(0, 0, List.of());
    }

    /**
     * Nothing was attempted: every requested id counts as failed, reported
     * through one synthetic error that names no candidate.
     */
    public static BulkActionResult batchFailure(int requested, String reason) {
        return new BulkActionResult(0, requested,
                List.of(BulkActionError.of(null, FailureKind.BATCH_ERROR, reason)));
    }

    public static BulkActionResult single(String candidateId, BulkActionError error) {
        return error == null
                ? new BulkActionResult(1, 0, List.of())
                : new BulkActionResult(0, 1, List.of(error));
    }
}
