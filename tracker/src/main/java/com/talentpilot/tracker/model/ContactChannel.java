package com.talentpilot.tracker.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Outbound channel used by the contact dispatch service. */
public enum ContactChannel {
    EMAIL,
    WHATSAPP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ContactChannel fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Contact channel must not be null");
        }
        return ContactChannel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
