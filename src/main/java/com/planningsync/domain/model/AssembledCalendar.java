package com.planningsync.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Calendar handed to publishers: unique events in chronological order.
 */
public record AssembledCalendar(List<CalendarEvent> events, Instant assembledAt) {

    public AssembledCalendar {
        events = List.copyOf(events);
    }

    public int size() {
        return events.size();
    }
}
