package com.talentpilot.tracker.grouping;

import com.talentpilot.tracker.model.OutreachState;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Ephemeral query over the candidate collection. Never persisted.
 * All present fields must match (logical AND).
 *
 * @param status      statuses to keep (logical OR); null or empty means no status filter
 * @param search      case-insensitive substring over "first last" and email; null or blank means none
 * @param dateFrom    keep candidates created at or after this instant; null means unbounded
 * @param dateTo      keep candidates created at or before this instant; null means unbounded
 * @param hasResponse true keeps candidates that replied, false those that did not; null means either
 */
public record TrackingFilters(Set<OutreachState> status, String search,
                              Instant dateFrom, Instant dateTo, Boolean hasResponse) {

    public TrackingFilters {
        status = (status == null || status.isEmpty()) ? Set.of() : Set.copyOf(EnumSet.copyOf(status));
        search = (search == null || search.isBlank()) ? null : search.strip();
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo)) {
            throw new IllegalArgumentException("date_from " + dateFrom + " is after date_to " + dateTo);
        }
    }

    public TrackingFilters(Set<OutreachState> status, String search) {
        this(status, search, null, null, null);
    }

    public static TrackingFilters none() {
        return new TrackingFilters(null, null);
    }

    public boolean hasStatusFilter()   { return !status.isEmpty(); }
    public boolean hasSearch()         { return search != null; }
    public boolean hasDateRange()      { return dateFrom != null || dateTo != null; }
    public boolean hasResponseFilter() { return hasResponse != null; }
}
