package com.planningsync.application.usecase;

import com.planningsync.domain.model.AssembledCalendar;
import com.planningsync.domain.model.CalendarEvent;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Turns the merged scrape output into the calendar handed to publishers.
 * Duplicates are collapsed and events are ordered by start, then course,
 * so the result does not depend on which week finished first.
 */
public class CalendarAssembler {

    private static final Comparator<CalendarEvent> CHRONOLOGICAL = Comparator
        .comparing(CalendarEvent::start)
        .thenComparing(CalendarEvent::course, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(CalendarEvent::room, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparingInt(CalendarEvent::durationMinutes)
        .thenComparing(e -> String.join(",", e.groups()))
        .thenComparing(CalendarEvent::instructor, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(CalendarEvent::notes, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final Clock clock;

    public CalendarAssembler(Clock clock) {
        this.clock = clock;
    }

    public AssembledCalendar assemble(Collection<CalendarEvent> events) {
        List<CalendarEvent> ordered = new LinkedHashSet<>(events).stream()
            .sorted(CHRONOLOGICAL)
            .toList();
        return new AssembledCalendar(ordered, clock.instant());
    }
}
