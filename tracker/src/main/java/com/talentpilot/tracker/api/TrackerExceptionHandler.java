package com.talentpilot.tracker.api;

import com.talentpilot.tracker.api.dto.BulkActionResponse;
import com.talentpilot.tracker.api.dto.ErrorResponse;
import com.talentpilot.tracker.bulk.BatchException;
import com.talentpilot.tracker.bulk.BulkActionResult;
import com.talentpilot.tracker.bulk.FailureKind;
import com.talentpilot.tracker.bulk.NotificationReporter;
import com.talentpilot.tracker.outreach.IllegalTransitionException;
import com.talentpilot.tracker.outreach.MissingContactInfoException;
import com.talentpilot.tracker.pipeline.IllegalStageTransitionException;
import com.talentpilot.tracker.service.CandidateNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions that escape a controller to HTTP responses.
 * Per-candidate failures inside a batch never reach here; they are part of
 * the batch result.
 */
@RestControllerAdvice
public class TrackerExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(TrackerExceptionHandler.class);

    private final NotificationReporter reporter;

    public TrackerExceptionHandler(NotificationReporter reporter) {
        this.reporter = reporter;
    }

    @ExceptionHandler(IllegalTransitionException.class)
    public ResponseEntity<ErrorResponse> illegalTransition(IllegalTransitionException e) {
        return error(HttpStatus.CONFLICT, FailureKind.ILLEGAL_TRANSITION.code(), e.getMessage());
    }

    @ExceptionHandler(IllegalStageTransitionException.class)
    public ResponseEntity<ErrorResponse> illegalStage(IllegalStageTransitionException e) {
        return error(HttpStatus.CONFLICT, "illegal_stage_transition", e.getMessage());
    }

    @ExceptionHandler(MissingContactInfoException.class)
    public ResponseEntity<ErrorResponse> missingContact(MissingContactInfoException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, FailureKind.MISSING_CONTACT_INFO.code(), e.getMessage());
    }

    @ExceptionHandler(CandidateNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(CandidateNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, FailureKind.NOT_FOUND.code(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    /**
     * Nothing was attempted. The body still has the batch shape, with every
     * requested candidate counted as failed, so clients handle one format.
     */
    @ExceptionHandler(BatchException.class)
    public ResponseEntity<BulkActionResponse> batchFailed(BatchException e) {
        log.error("Batch {} rejected ({}): {}", e.getOperation(), e.getReason(), e.getMessage());
        BulkActionResult result = BulkActionResult.batchFailure(e.getCandidateIds().size(), e.getReason());
        HttpStatus status = BatchException.BATCH_TOO_LARGE.equals(e.getReason())
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status)
                .body(BulkActionResponse.from(result, reporter.report(e.getOperation(), result)));
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }
}
