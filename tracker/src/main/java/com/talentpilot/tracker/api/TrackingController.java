package com.talentpilot.tracker.api;

import com.talentpilot.tracker.api.dto.ActivityResponse;
import com.talentpilot.tracker.api.dto.AllowedActionsResponse;
import com.talentpilot.tracker.api.dto.BulkActionResponse;
import com.talentpilot.tracker.api.dto.BulkContactRequest;
import com.talentpilot.tracker.api.dto.BulkResendRequest;
import com.talentpilot.tracker.api.dto.BulkStatusRequest;
import com.talentpilot.tracker.api.dto.ContactRequest;
import com.talentpilot.tracker.api.dto.NoteRequest;
import com.talentpilot.tracker.api.dto.RoleSummaryResponse;
import com.talentpilot.tracker.api.dto.StatsResponse;
import com.talentpilot.tracker.api.dto.StatusUpdateRequest;
import com.talentpilot.tracker.api.dto.TrackedCandidateResponse;
import com.talentpilot.tracker.api.dto.TrackingResponse;
import com.talentpilot.tracker.bulk.BulkActionError;
import com.talentpilot.tracker.bulk.BulkActionOrchestrator;
import com.talentpilot.tracker.bulk.BulkActionResult;
import com.talentpilot.tracker.bulk.BulkOperation;
import com.talentpilot.tracker.bulk.NotificationReporter;
import com.talentpilot.tracker.config.TrackerProperties;
import com.talentpilot.tracker.grouping.CandidateGroupingIndex;
import com.talentpilot.tracker.grouping.TrackingFilters;
import com.talentpilot.tracker.grouping.TrackingStatsCalculator;
import com.talentpilot.tracker.model.OutreachEvent;
import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.TrackedCandidate;
import com.talentpilot.tracker.outreach.OutreachStateMachine;
import com.talentpilot.tracker.service.TrackingService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * REST API for outreach tracking.
 *
 * GET   /candidates                       candidates grouped by status
 * GET   /candidates/filtered              status / text / date / response filtered list
 * GET   /candidates/resend-eligible       NO_RESPONSE candidates due for a reminder
 * POST  /bulk/contact | /bulk/resend | /bulk/status
 * PATCH /candidates/{id}/status           one candidate, same rules as /bulk/status
 * POST  /candidates/{id}/status/override
 * POST  /candidates/{id}/contact | /candidates/{id}/notes
 * GET   /candidates/{id}/actions          legal operator actions
 * GET   /activity | /stats | /vacantes
 *
 * The acting operator comes from the optional X-Actor header.
 */
@RestController
@RequestMapping("/api/v1/tracking")
public class TrackingController {

    static final String ACTOR_HEADER = "X-Actor";

    private final TrackingService         trackingService;
    private final BulkActionOrchestrator  orchestrator;
    private final NotificationReporter    reporter;
    private final CandidateGroupingIndex  groupingIndex;
    private final TrackingStatsCalculator statsCalculator;
    private final OutreachStateMachine    stateMachine;
    private final TrackerProperties       properties;
    private final Clock                   clock;

    public TrackingController(TrackingService trackingService,
                              BulkActionOrchestrator orchestrator,
                              NotificationReporter reporter,
                              CandidateGroupingIndex groupingIndex,
                              TrackingStatsCalculator statsCalculator,
                              OutreachStateMachine stateMachine,
                              TrackerProperties properties,
                              Clock clock) {
        this.trackingService = trackingService;
        this.orchestrator    = orchestrator;
        this.reporter        = reporter;
        this.groupingIndex   = groupingIndex;
        this.statsCalculator = statsCalculator;
        this.stateMachine    = stateMachine;
        this.properties      = properties;
        this.clock           = clock;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @GetMapping("/candidates")
    public TrackingResponse getTracking(@RequestParam(name = "role_id", required = false) String roleId) {
        return TrackingResponse.from(trackingService.fetchTracking(roleId), clock.instant());
    }

    @GetMapping("/candidates/filtered")
    public List<TrackedCandidateResponse> getFiltered(
            @RequestParam(name = "role_id", required = false) String roleId,
            @RequestParam(name = "status", required = false) Set<OutreachState> status,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "date_from", required = false) Instant dateFrom,
            @RequestParam(name = "date_to", required = false) Instant dateTo,
            @RequestParam(name = "has_response", required = false) Boolean hasResponse) {
        TrackingFilters filters = new TrackingFilters(status, search, dateFrom, dateTo, hasResponse);
        List<TrackedCandidate> filtered = groupingIndex.applyFilters(
                trackingService.findCandidates(roleId), filters);
        return toResponses(filtered);
    }

    @GetMapping("/candidates/resend-eligible")
    public List<TrackedCandidateResponse> getResendEligible(
            @RequestParam(name = "role_id", required = false) String roleId) {
        List<TrackedCandidate> eligible = groupingIndex.resendEligible(
                trackingService.findCandidates(roleId),
                properties.getOutreach().getResendAfterDays(),
                clock.instant());
        return toResponses(eligible);
    }

    @GetMapping("/candidates/{id}/actions")
    public AllowedActionsResponse getActions(@PathVariable UUID id) {
        TrackedCandidate c = trackingService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Candidate not found: " + id));
        List<String> actions = stateMachine.allowedUserEvents(c).stream()
                .map(OutreachEvent::wireName)
                .toList();
        return new AllowedActionsResponse(c.getId(), c.getStatus(), c.isMissingContact(), actions);
    }

    @GetMapping("/activity")
    public List<ActivityResponse> getActivity(@RequestParam(defaultValue = "20") int limit) {
        return trackingService.recentActivity(limit).stream()
                .map(ActivityResponse::from)
                .toList();
    }

    @GetMapping("/stats")
    public StatsResponse getStats(@RequestParam(name = "role_id", required = false) String roleId) {
        return StatsResponse.from(statsCalculator.stats(trackingService.findCandidates(roleId)));
    }

    @GetMapping("/vacantes")
    public List<RoleSummaryResponse> getRoleSummaries() {
        return statsCalculator.roleSummaries(trackingService.findCandidates(null)).stream()
                .map(RoleSummaryResponse::from)
                .toList();
    }

    // ------------------------------------------------------------------
    // Bulk mutations
    // ------------------------------------------------------------------

    @PostMapping("/bulk/contact")
    public BulkActionResponse bulkContact(@RequestBody BulkContactRequest req,
                                          @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        if (req.channel() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "channel is required");
        }
        BulkActionResult result = orchestrator.contactMultiple(
                req.candidateIds(), req.channel(), req.messageTemplate(), actorOf(actor));
        return respond(BulkOperation.CONTACT, result);
    }

    @PostMapping("/bulk/resend")
    public BulkActionResponse bulkResend(@RequestBody BulkResendRequest req,
                                         @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        BulkActionResult result = orchestrator.resendToNoResponse(
                req.candidateIds(), req.customMessage(), actorOf(actor));
        return respond(BulkOperation.RESEND, result);
    }

    @PostMapping("/bulk/status")
    public BulkActionResponse bulkStatus(@RequestBody BulkStatusRequest req,
                                         @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        if (req.status() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "status is required");
        }
        BulkActionResult result = orchestrator.updateStatus(
                req.candidateIds(), req.status(), req.notes(), actorOf(actor));
        return respond(BulkOperation.UPDATE_STATUS, result);
    }

    // ------------------------------------------------------------------
    // Single-candidate mutations
    // ------------------------------------------------------------------

    @PatchMapping("/candidates/{id}/status")
    public ResponseEntity<BulkActionResponse> updateStatus(
            @PathVariable String id, @RequestBody StatusUpdateRequest req,
            @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        if (req.status() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "status is required");
        }
        BulkActionResult result = orchestrator.updateStatus(List.of(id), req.status(), req.notes(), actorOf(actor));
        return single(BulkOperation.UPDATE_STATUS, result);
    }

    @PostMapping("/candidates/{id}/status/override")
    public ResponseEntity<BulkActionResponse> overrideStatus(
            @PathVariable String id, @RequestBody StatusUpdateRequest req,
            @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        if (req.status() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "status is required");
        }
        BulkActionResult result = orchestrator.forceStatus(List.of(id), req.status(), req.notes(), actorOf(actor));
        return single(BulkOperation.FORCE_STATUS, result);
    }

    @PostMapping("/candidates/{id}/contact")
    public ResponseEntity<BulkActionResponse> contact(
            @PathVariable String id, @RequestBody ContactRequest req,
            @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        if (req.channel() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "channel is required");
        }
        BulkActionResult result = orchestrator.contactMultiple(List.of(id), req.channel(), req.message(), actorOf(actor));
        return single(BulkOperation.CONTACT, result);
    }

    @PostMapping("/candidates/{id}/notes")
    public ResponseEntity<BulkActionResponse> addNote(
            @PathVariable String id, @RequestBody NoteRequest req,
            @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        if (req.note() == null || req.note().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "note must not be blank");
        }
        BulkActionResult result = orchestrator.addNote(id, req.note(), actorOf(actor));
        return single(BulkOperation.ADD_NOTE, result);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private BulkActionResponse respond(BulkOperation operation, BulkActionResult result) {
        return BulkActionResponse.from(result, reporter.report(operation, result));
    }

    /**
     * Single-item calls keep the batch body but carry the failure in the
     * HTTP status, so simple clients can branch on it.
     */
    private ResponseEntity<BulkActionResponse> single(BulkOperation operation, BulkActionResult result) {
        BulkActionResponse body = respond(operation, result);
        if (result.success()) {
            return ResponseEntity.ok(body);
        }
        BulkActionError error = result.errors().get(0);
        return ResponseEntity.status(statusFor(error)).body(body);
    }

    static HttpStatus statusFor(BulkActionError error) {
        return switch (error.kind()) {
            case NOT_FOUND                                 -> HttpStatus.NOT_FOUND;
            case ILLEGAL_TRANSITION, INVALID_STATE         -> HttpStatus.CONFLICT;
            case MISSING_CONTACT_INFO, CHANNEL_UNAVAILABLE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CHANNEL_ERROR                             -> HttpStatus.BAD_GATEWAY;
            case TIMEOUT                                   -> HttpStatus.GATEWAY_TIMEOUT;
            case PERSISTENCE_ERROR, INTERNAL_ERROR         -> HttpStatus.INTERNAL_SERVER_ERROR;
            case BATCH_ERROR                               -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private List<TrackedCandidateResponse> toResponses(List<TrackedCandidate> candidates) {
        Instant now = clock.instant();
        return candidates.stream().map(c -> TrackedCandidateResponse.from(c, now)).toList();
    }

    private static String actorOf(String header) {
        return (header == null || header.isBlank()) ? BulkActionOrchestrator.SYSTEM_ACTOR : header.strip();
    }
}
