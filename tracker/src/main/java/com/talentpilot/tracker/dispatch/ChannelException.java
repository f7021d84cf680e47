package com.talentpilot.tracker.dispatch;

/**
 * Thrown when the contact dispatch service rejects or cannot deliver a message.
 *
 * {@link #getReason()} is the provider's machine-readable code
 * (invalid_address, provider_error, rate_limited, ...) and is reported
 * to callers verbatim.
 */
public class ChannelException extends RuntimeException {

    public static final String PROVIDER_ERROR       = "provider_error";
    public static final String PROVIDER_UNREACHABLE = "provider_unreachable";
    public static final String RATE_LIMITED         = "rate_limited";

    private final String reason;

    public ChannelException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ChannelException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String getReason() { return reason; }
}
