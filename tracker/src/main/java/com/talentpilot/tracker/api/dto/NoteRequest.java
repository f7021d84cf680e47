package com.talentpilot.tracker.api.dto;

public record NoteRequest(String note) {}
