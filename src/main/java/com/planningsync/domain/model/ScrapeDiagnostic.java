package com.planningsync.domain.model;

/**
 * A contained failure reported by a run.
 *
 * @param isoWeek   week the failure belongs to
 * @param cellIndex index of the cell within the week, null for week-level failures
 * @param kind      failure category
 * @param message   human-readable detail
 */
public record ScrapeDiagnostic(int isoWeek, Integer cellIndex, ScrapeErrorKind kind, String message) {

    public static ScrapeDiagnostic forWeek(WeekTarget target, ScrapeErrorKind kind, String message) {
        return new ScrapeDiagnostic(target.isoWeek(), null, kind, message);
    }

    public static ScrapeDiagnostic forCell(WeekTarget target, int cellIndex, ScrapeException e) {
        return new ScrapeDiagnostic(target.isoWeek(), cellIndex, e.getKind(), e.getMessage());
    }
}
