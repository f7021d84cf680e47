package com.talentpilot.tracker.api.dto;

/** Body of non-2xx responses that are not batch results. */
public record ErrorResponse(String error, String message) {}
