package com.talentpilot.tracker.bulk;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a single candidate failed inside a batch, and what an operator
 * should do about it.
 *
 * CHANNEL_ERROR and PERSISTENCE_ERROR must never be confused: the first
 * means nothing was sent and the same operation can be retried; the second
 * means the message went out but the status write failed, so a resend
 * would message the candidate twice.
 */
public enum FailureKind {
    NOT_FOUND("not_found", Recovery.NONE),
    MISSING_CONTACT_INFO("missing_contact_info", Recovery.UPDATE_CONTACT_INFO),
    CHANNEL_UNAVAILABLE("channel_unavailable", Recovery.UPDATE_CONTACT_INFO),
    INVALID_STATE("invalid_state", Recovery.NONE),
    ILLEGAL_TRANSITION("illegal_transition", Recovery.NONE),
    CHANNEL_ERROR("channel_error", Recovery.RETRY),
    PERSISTENCE_ERROR("persistence_error", Recovery.REPAIR_STATUS),
    TIMEOUT("timeout", Recovery.VERIFY),
    INTERNAL_ERROR("internal_error", Recovery.RETRY),
    // Whole batch rejected before any candidate was attempted.
    BATCH_ERROR("batch_error", Recovery.RETRY);

    public enum Recovery {
        RETRY,
        REPAIR_STATUS,
        UPDATE_CONTACT_INFO,
        VERIFY,
        NONE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final String code;
    private final Recovery recovery;

    FailureKind(String code, Recovery recovery) {
        this.code     = code;
        this.recovery = recovery;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public Recovery recovery() {
        return recovery;
    }
}
