package com.talentpilot.tracker.api.dto;

import com.talentpilot.tracker.bulk.BulkActionError;
import com.talentpilot.tracker.bulk.BulkActionResult;
import com.talentpilot.tracker.bulk.FailureKind;
import com.talentpilot.tracker.bulk.NotificationReporter;

import java.util.List;
import java.util.Locale;

/**
 * Response body for every bulk and single-item mutation.
 * message is the one summary line shown to the operator.
 */
public record BulkActionResponse(
        boolean          success,
        int              processed,
        int              failed,
        List<ErrorEntry> errors,
        String           message,
        String           level
) {
    public record ErrorEntry(String candidateId, String reason, FailureKind kind, FailureKind.Recovery recovery) {

        static ErrorEntry from(BulkActionError e) {
            return new ErrorEntry(e.candidateId(), e.reason(), e.kind(), e.recovery());
        }
    }

    public static BulkActionResponse from(BulkActionResult result, NotificationReporter.Notification notification) {
        return new BulkActionResponse(
                result.success(),
                result.processed(),
                result.failed(),
                result.errors().stream().map(ErrorEntry::from).toList(),
                notification.message(),
                notification.level().name().toLowerCase(Locale.ROOT)
        );
    }
}
