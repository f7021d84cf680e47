package com.talentpilot.tracker.model;

import java.util.Locale;

/**
 * Events that move a candidate between {@link OutreachState}s.
 *
 * MARK_NO_RESPONSE is raised only by the system (the no-response sweep);
 * it is never offered to an operator.
 */
public enum OutreachEvent {
    CONTACT,
    MARK_INTERESTED,
    MARK_NOT_INTERESTED,
    MARK_NO_RESPONSE,
    SCHEDULE,
    COMPLETE,
    HIRE,
    REJECT;

    public boolean isSystemOnly() {
        return this == MARK_NO_RESPONSE;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
