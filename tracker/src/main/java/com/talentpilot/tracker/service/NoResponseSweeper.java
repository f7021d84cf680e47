package com.talentpilot.tracker.service;

import com.talentpilot.tracker.config.TrackerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Background job that raises the system-only MARK_NO_RESPONSE event.
 *
 * Off by default: deployments where an upstream system already computes
 * no-response turn it on only after switching that off. The interval is
 * a fixed delay, so a slow sweep never overlaps the next one.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "tracker.outreach", name = "sweep-enabled", havingValue = "true")
public class NoResponseSweeper {

    private static final Logger log = LoggerFactory.getLogger(NoResponseSweeper.class);

    private final TrackingService   trackingService;
    private final TrackerProperties properties;
    private final Clock             clock;

    public NoResponseSweeper(TrackingService trackingService, TrackerProperties properties, Clock clock) {
        this.trackingService = trackingService;
        this.properties      = properties;
        this.clock           = clock;
    }

    @Scheduled(fixedDelayString = "${tracker.outreach.sweep-interval-ms:900000}")
    public void sweep() {
        Duration quiet = Duration.ofHours(properties.getOutreach().getNoResponseAfterHours());
        Instant cutoff = clock.instant().minus(quiet);
        try {
            int moved = trackingService.markNoResponse(cutoff);
            if (moved > 0) {
                log.info("No-response sweep moved {} candidate(s) contacted before {}", moved, cutoff);
            }
        } catch (Exception e) {
            log.error("No-response sweep failed: {}", e.getMessage(), e);
        }
    }
}
