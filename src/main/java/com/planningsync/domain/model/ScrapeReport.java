package com.planningsync.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Merged result of a multi-week run.
 */
public record ScrapeReport(List<CalendarEvent> events, List<WeekOutcome> weeks) {

    public ScrapeReport {
        events = List.copyOf(events);
        weeks = List.copyOf(weeks);
    }

    public List<ScrapeDiagnostic> diagnostics() {
        List<ScrapeDiagnostic> all = new ArrayList<>();
        for (WeekOutcome week : weeks) {
            all.addAll(week.diagnostics());
        }
        return all;
    }

    public List<WeekOutcome> failedWeeks() {
        return weeks.stream().filter(WeekOutcome::failed).toList();
    }
}
