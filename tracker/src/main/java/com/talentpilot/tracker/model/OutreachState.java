package com.talentpilot.tracker.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a candidate sits in the contact-and-respond lifecycle for one role.
 *
 * Transitions are owned by {@link com.talentpilot.tracker.outreach.OutreachStateMachine};
 * nothing else decides whether a move is legal.
 *
 *   PENDING_CONTACT → CONTACTED → INTERESTED → SCHEDULED → COMPLETED → HIRED
 *                         ↓            ↓           ↓           ↓
 *                    NO_RESPONSE   NOT_INTERESTED (terminal, reachable from most states)
 */
public enum OutreachState {
    PENDING_CONTACT("pending_contact"),
    CONTACTED("contacted"),
    INTERESTED("interested"),
    NOT_INTERESTED("not_interested"),
    NO_RESPONSE("no_response"),
    SCHEDULED("scheduled"),
    COMPLETED("completed"),
    HIRED("hired");

    private final String wireName;

    OutreachState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == NOT_INTERESTED || this == HIRED;
    }

    /**
     * Parse the snake_case wire value. Unknown values are a caller bug and fail loudly.
     */
    @JsonCreator
    public static OutreachState fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Outreach state must not be null");
        }
        for (OutreachState s : values()) {
            if (s.wireName.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown outreach state: '" + value + "'");
    }
}
