package com.talentpilot.tracker.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Recruiting-funnel stage of an {@link Application}.
 *
 * Happy path: SOURCING → SHORTLIST → TERNA → INTERVIEW → OFFER → HIRED.
 * REJECTED is reachable from any non-terminal stage and ends the application.
 * Ordering and completion queries live in
 * {@link com.talentpilot.tracker.pipeline.StageModel}.
 */
public enum PipelineStage {
    SOURCING,
    SHORTLIST,
    TERNA,        // three-candidate short list presented to the client
    INTERVIEW,
    OFFER,
    HIRED,
    REJECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PipelineStage fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Pipeline stage must not be null");
        }
        return PipelineStage.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
