package com.talentpilot.tracker.api.dto;

import com.talentpilot.tracker.model.ContactChannel;

public record ContactRequest(ContactChannel channel, String message) {}
