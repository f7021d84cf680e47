package com.talentpilot.tracker.bulk;

import com.talentpilot.tracker.config.TrackerProperties;
import com.talentpilot.tracker.dispatch.ChannelException;
import com.talentpilot.tracker.dispatch.ContactDispatchClient;
import com.talentpilot.tracker.model.ContactChannel;
import com.talentpilot.tracker.model.OutreachEvent;
import com.talentpilot.tracker.model.OutreachState;
import com.talentpilot.tracker.model.TrackedCandidate;
import com.talentpilot.tracker.outreach.IllegalTransitionException;
import com.talentpilot.tracker.outreach.MissingContactInfoException;
import com.talentpilot.tracker.outreach.OutreachStateMachine;
import com.talentpilot.tracker.service.CandidateNotFoundException;
import com.talentpilot.tracker.service.TrackingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs an operation over a set of candidates and reports one aggregate result.
 *
 * Flow per batch:
 *   1. De-duplicate ids by candidate (first spelling wins) and load them in one read.
 *      If that read fails nothing was attempted and a {@link BatchException}
 *      is thrown.
 *   2. Ids that are not tracked fail with NOT_FOUND and are never dispatched.
 *   3. Every other candidate runs on the bounded outreach executor. A failing
 *      candidate records an error and never stops its siblings.
 *   4. Results are collected once every item has finished, or once the batch
 *      timeout expires; unfinished items are reported as TIMEOUT.
 *
 * Per-candidate order inside an item is fixed: validate, dispatch, then
 * persist. A send that succeeded followed by a failed write is reported as
 * PERSISTENCE_ERROR, never as a channel failure.
 *
 * Metrics:
 * <pre>
 *   tracker.bulk.items{operation, outcome="processed|&lt;failure kind&gt;"}
 *   tracker.bulk.duration{operation}
 * </pre>
 */
@Component
public class BulkActionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BulkActionOrchestrator.class);

    public static final String SYSTEM_ACTOR = "system";

    static final String CONTACT_REQUIRES_DISPATCH = "contact_requires_dispatch";

    private final TrackingService       trackingService;
    private final ContactDispatchClient dispatchClient;
    private final OutreachStateMachine  stateMachine;
    private final Executor              executor;
    private final TrackerProperties     properties;
    private final MeterRegistry         meterRegistry;

    public BulkActionOrchestrator(TrackingService trackingService,
                                  ContactDispatchClient dispatchClient,
                                  OutreachStateMachine stateMachine,
                                  @Qualifier("outreachExecutor") Executor executor,
                                  TrackerProperties properties,
                                  MeterRegistry meterRegistry) {
        this.trackingService = trackingService;
        this.dispatchClient  = dispatchClient;
        this.stateMachine    = stateMachine;
        this.executor        = executor;
        this.properties      = properties;
        this.meterRegistry   = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Operations
    // ------------------------------------------------------------------

    public BulkActionResult contactMultiple(Collection<String> ids, ContactChannel channel, String template) {
        return contactMultiple(ids, channel, template, SYSTEM_ACTOR);
    }

    /**
     * First contact (or re-contact after NO_RESPONSE) over one channel.
     * Candidates without any contact info fail before anything is sent.
     */
    public BulkActionResult contactMultiple(Collection<String> ids, ContactChannel channel,
                                            String template, String actor) {
        if (channel == null) {
            throw new IllegalArgumentException("channel is required");
        }
        return run(BulkOperation.CONTACT, ids, (rawId, c) -> {
            if (c.isMissingContact()) {
                return BulkActionError.of(rawId, FailureKind.MISSING_CONTACT_INFO);
            }
            if (!stateMachine.canTransition(c, OutreachEvent.CONTACT)) {
                return BulkActionError.of(rawId, FailureKind.ILLEGAL_TRANSITION);
            }
            if (!c.hasAddressFor(channel)) {
                return BulkActionError.of(rawId, FailureKind.CHANNEL_UNAVAILABLE);
            }
            return dispatchThenRecord(rawId, c, channel, template, false, actor);
        });
    }

    public BulkActionResult resendToNoResponse(Collection<String> ids, String customMessage) {
        return resendToNoResponse(ids, customMessage, SYSTEM_ACTOR);
    }

    /**
     * Reminder for candidates in NO_RESPONSE, over the channel used last
     * time when it still has an address. Any other status is INVALID_STATE.
     */
    public BulkActionResult resendToNoResponse(Collection<String> ids, String customMessage, String actor) {
        return run(BulkOperation.RESEND, ids, (rawId, c) -> {
            if (c.getStatus() != OutreachState.NO_RESPONSE) {
                return BulkActionError.of(rawId, FailureKind.INVALID_STATE);
            }
            if (c.isMissingContact()) {
                return BulkActionError.of(rawId, FailureKind.MISSING_CONTACT_INFO);
            }
            ContactChannel channel = resendChannel(c);
            return dispatchThenRecord(rawId, c, channel, customMessage, true, actor);
        });
    }

    public BulkActionResult updateStatus(String id, OutreachState target, String notes) {
        return updateStatus(List.of(id), target, notes, SYSTEM_ACTOR);
    }

    /**
     * Operator status change through the transition table. Nothing is sent,
     * so CONTACTED is never a target here: it is reached by contactMultiple
     * or, for contact made outside the system, by forceStatus.
     */
    public BulkActionResult updateStatus(Collection<String> ids, OutreachState target,
                                         String notes, String actor) {
        if (target == null) {
            throw new IllegalArgumentException("target status is required");
        }
        return run(BulkOperation.UPDATE_STATUS, ids, (rawId, c) -> {
            Optional<OutreachEvent> event = stateMachine.impliedUserEvent(c.getStatus(), target);
            if (event.isEmpty()) {
                return BulkActionError.of(rawId, FailureKind.ILLEGAL_TRANSITION);
            }
            if (event.get() == OutreachEvent.CONTACT) {
                return BulkActionError.of(rawId, FailureKind.ILLEGAL_TRANSITION, CONTACT_REQUIRES_DISPATCH);
            }
            return write(rawId, () -> trackingService.updateStatus(c.getId(), target, notes, actor));
        });
    }

    /** Explicit override that skips the transition table. */
    public BulkActionResult forceStatus(Collection<String> ids, OutreachState target,
                                        String notes, String actor) {
        if (target == null) {
            throw new IllegalArgumentException("target status is required");
        }
        return run(BulkOperation.FORCE_STATUS, ids, (rawId, c) ->
                write(rawId, () -> trackingService.forceStatus(c.getId(), target, notes, actor)));
    }

    public BulkActionResult addNote(String id, String note, String actor) {
        if (note == null || note.isBlank()) {
            throw new IllegalArgumentException("note must not be blank");
        }
        return run(BulkOperation.ADD_NOTE, List.of(id), (rawId, c) ->
                write(rawId, () -> trackingService.addNote(c.getId(), note, actor)));
    }

    // ------------------------------------------------------------------
    // Batch runner
    // ------------------------------------------------------------------

    @FunctionalInterface
    private interface ItemAction {
        /** @return null on success, otherwise the item's error */
        BulkActionError apply(String rawId, TrackedCandidate candidate);
    }

    private BulkActionResult run(BulkOperation operation, Collection<String> rawIds, ItemAction action) {
        // One entry per candidate: spellings that parse to the same UUID
        // (case, surrounding whitespace) collapse onto the first one seen.
        Set<String> ids = new LinkedHashSet<>();
        Map<String, UUID> parsed = new LinkedHashMap<>();
        Set<UUID> seen = new HashSet<>();
        if (rawIds != null) {
            for (String id : rawIds) {
                if (id == null) {
                    continue;
                }
                Optional<UUID> uuid = parseId(id);
                if (uuid.isEmpty()) {
                    ids.add(id);
                } else if (seen.add(uuid.get())) {
                    ids.add(id);
                    parsed.put(id, uuid.get());
                }
            }
        }
        if (ids.isEmpty()) {
            return BulkActionResult.empty();
        }
        int maxBatch = properties.getBulk().getMaxBatchSize();
        if (ids.size() > maxBatch) {
            throw new BatchException(operation, ids, BatchException.BATCH_TOO_LARGE,
                    "Batch of " + ids.size() + " exceeds the limit of " + maxBatch, null);
        }

        String batchId = UUID.randomUUID().toString().substring(0, 8);
        String previousBatch = MDC.get("batchId");
        String previousOperation = MDC.get("operation");
        MDC.put("batchId", batchId);
        MDC.put("operation", operation.metricTag());
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Map<UUID, TrackedCandidate> found;
            try {
                found = parsed.isEmpty() ? Map.of() : trackingService.findAllById(parsed.values());
            } catch (RuntimeException e) {
                log.error("Batch {} could not load {} candidates: {}", operation, ids.size(), e.getMessage(), e);
                throw new BatchException(operation, ids, BatchException.STORE_UNAVAILABLE,
                        "Could not load candidates: " + e.getMessage(), e);
            }

            log.info("Batch {} started: {} candidates, {} tracked", operation, ids.size(), found.size());

            AtomicBoolean closed = new AtomicBoolean(false);
            Map<String, CompletableFuture<BulkActionError>> futures = new LinkedHashMap<>();
            List<BulkActionError> errors = new ArrayList<>();
            int processed = 0;

            for (String id : ids) {
                UUID uuid = parsed.get(id);
                TrackedCandidate candidate = uuid == null ? null : found.get(uuid);
                if (candidate == null) {
                    errors.add(BulkActionError.of(id, FailureKind.NOT_FOUND));
                    continue;
                }
                futures.put(id, submit(id, candidate, action, closed));
            }

            awaitAll(operation, futures.values(), closed);

            for (Map.Entry<String, CompletableFuture<BulkActionError>> e : futures.entrySet()) {
                BulkActionError error = outcomeOf(e.getKey(), e.getValue());
                if (error == null) {
                    processed++;
                } else {
                    errors.add(error);
                }
            }

            BulkActionResult result = new BulkActionResult(processed, errors.size(), errors);
            recordMetrics(operation, result);
            log.info("Batch {} finished: {} processed, {} failed", operation, result.processed(), result.failed());
            return result;
        } finally {
            sample.stop(meterRegistry.timer("tracker.bulk.duration", "operation", operation.metricTag()));
            restore("batchId", previousBatch);
            restore("operation", previousOperation);
        }
    }

    private CompletableFuture<BulkActionError> submit(String rawId, TrackedCandidate candidate,
                                                      ItemAction action, AtomicBoolean closed) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                // Batch already timed out: do not start sending now.
                if (closed.get()) {
                    return BulkActionError.of(rawId, FailureKind.TIMEOUT);
                }
                MDC.put("candidateId", rawId);
                try {
                    return action.apply(rawId, candidate);
                } catch (RuntimeException e) {
                    log.error("Unexpected error for candidate {}: {}", rawId, e.getMessage(), e);
                    return BulkActionError.of(rawId, FailureKind.INTERNAL_ERROR);
                } finally {
                    MDC.remove("candidateId");
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            log.error("Executor rejected candidate {}: {}", rawId, e.getMessage());
            return CompletableFuture.completedFuture(
                    BulkActionError.of(rawId, FailureKind.INTERNAL_ERROR, "executor_rejected"));
        }
    }

    private void awaitAll(BulkOperation operation, Collection<CompletableFuture<BulkActionError>> futures,
                          AtomicBoolean closed) {
        if (futures.isEmpty()) {
            return;
        }
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        Duration timeout = properties.getBulk().getBatchTimeout();
        try {
            if (timeout.isZero()) {
                all.get();
            } else {
                all.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            log.warn("Batch {} timed out after {}; unfinished items reported as timeout", operation, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Batch {} interrupted while waiting for items", operation);
        } catch (ExecutionException e) {
            // Items never complete exceptionally; outcomeOf handles it if one does.
            log.error("Batch {} item failed unexpectedly: {}", operation, e.getMessage(), e);
        } finally {
            closed.set(true);
        }
    }

    private BulkActionError outcomeOf(String rawId, CompletableFuture<BulkActionError> future) {
        if (!future.isDone()) {
            return BulkActionError.of(rawId, FailureKind.TIMEOUT);
        }
        try {
            return future.getNow(null);
        } catch (RuntimeException e) {
            return BulkActionError.of(rawId, FailureKind.INTERNAL_ERROR);
        }
    }

    // ------------------------------------------------------------------
    // Item steps
    // ------------------------------------------------------------------

    private BulkActionError dispatchThenRecord(String rawId, TrackedCandidate c, ContactChannel channel,
                                               String message, boolean reminder, String actor) {
        try {
            dispatchClient.send(c.getId(), channel, message);
        } catch (ChannelException e) {
            log.warn("Dispatch failed for candidate {} over {}: {}", rawId, channel.wireName(), e.getReason());
            return BulkActionError.of(rawId, FailureKind.CHANNEL_ERROR, e.getReason());
        } catch (RuntimeException e) {
            log.warn("Dispatch failed for candidate {} over {}: {}", rawId, channel.wireName(), e.getMessage());
            return BulkActionError.of(rawId, FailureKind.CHANNEL_ERROR, ChannelException.PROVIDER_ERROR);
        }

        try {
            trackingService.recordContact(c.getId(), channel, reminder, message, actor);
            return null;
        } catch (IllegalTransitionException | MissingContactInfoException e) {
            log.error("Message sent to candidate {} but status write was rejected: {}", rawId, e.getMessage());
            return BulkActionError.of(rawId, FailureKind.PERSISTENCE_ERROR, "status_write_rejected");
        } catch (RuntimeException e) {
            log.error("Message sent to candidate {} but status write failed: {}", rawId, e.getMessage(), e);
            return BulkActionError.of(rawId, FailureKind.PERSISTENCE_ERROR);
        }
    }

    /** Status-only write; no message is involved, so store rejections keep their own kind. */
    private BulkActionError write(String rawId, Runnable write) {
        try {
            write.run();
            return null;
        } catch (IllegalTransitionException e) {
            return BulkActionError.of(rawId, FailureKind.ILLEGAL_TRANSITION);
        } catch (MissingContactInfoException e) {
            return BulkActionError.of(rawId, FailureKind.MISSING_CONTACT_INFO);
        } catch (CandidateNotFoundException e) {
            return BulkActionError.of(rawId, FailureKind.NOT_FOUND);
        } catch (RuntimeException e) {
            log.error("Status write failed for candidate {}: {}", rawId, e.getMessage(), e);
            return BulkActionError.of(rawId, FailureKind.PERSISTENCE_ERROR);
        }
    }

    private static ContactChannel resendChannel(TrackedCandidate c) {
        ContactChannel last = c.getLastContactChannel();
        if (last != null && c.hasAddressFor(last)) {
            return last;
        }
        return c.hasAddressFor(ContactChannel.EMAIL) ? ContactChannel.EMAIL : ContactChannel.WHATSAPP;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Optional<UUID> parseId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(id.strip()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private void recordMetrics(BulkOperation operation, BulkActionResult result) {
        String op = operation.metricTag();
        if (result.processed() > 0) {
            meterRegistry.counter("tracker.bulk.items", "operation", op, "outcome", "processed")
                    .increment(result.processed());
        }
        for (BulkActionError e : result.errors()) {
            meterRegistry.counter("tracker.bulk.items", "operation", op, "outcome", e.kind().code()).increment();
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
