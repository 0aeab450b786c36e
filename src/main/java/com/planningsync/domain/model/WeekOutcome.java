package com.planningsync.domain.model;

import java.util.List;

/**
 * Result of scraping one week. A failed week carries no events and at least
 * one week-level diagnostic; a successful week may still carry cell diagnostics.
 */
public record WeekOutcome(
    WeekTarget target,
    List<CalendarEvent> events,
    List<ScrapeDiagnostic> diagnostics,
    boolean failed
) {

    public WeekOutcome {
        events = List.copyOf(events);
        diagnostics = List.copyOf(diagnostics);
    }

    public static WeekOutcome succeeded(WeekTarget target, List<CalendarEvent> events,
                                        List<ScrapeDiagnostic> cellDiagnostics) {
        return new WeekOutcome(target, events, cellDiagnostics, false);
    }

    public static WeekOutcome empty(WeekTarget target) {
        return new WeekOutcome(target, List.of(), List.of(), false);
    }

    public static WeekOutcome failed(WeekTarget target, ScrapeErrorKind kind, String message) {
        return new WeekOutcome(target, List.of(),
            List.of(ScrapeDiagnostic.forWeek(target, kind, message)), true);
    }
}
