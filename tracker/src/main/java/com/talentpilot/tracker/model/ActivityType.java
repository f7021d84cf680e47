package com.talentpilot.tracker.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Kind of entry in the outreach activity feed. */
public enum ActivityType {
    MESSAGE_SENT,
    REMINDER_SENT,
    STATUS_CHANGED,
    NOTE_ADDED,
    CONTACT_ATTEMPT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
