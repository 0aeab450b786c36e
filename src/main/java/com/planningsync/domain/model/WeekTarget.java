package com.planningsync.domain.model;

/**
 * One week to scrape.
 *
 * @param isoWeek   ISO-8601 week number shown by the pagination control
 * @param weekDelta weeks after the anchor week, 0 for the current week
 */
public record WeekTarget(int isoWeek, int weekDelta) {

    public WeekTarget {
        if (isoWeek < 1 || isoWeek > 53) {
            throw new IllegalArgumentException("Invalid ISO week: " + isoWeek);
        }
        if (weekDelta < 0) {
            throw new IllegalArgumentException("weekDelta must not be negative: " + weekDelta);
        }
    }

    public boolean isCurrentWeek() {
        return weekDelta == 0;
    }

    /** Text carried by the pagination control for this week, e.g. "(42)". */
    public String paginationLabel() {
        return "(" + isoWeek + ")";
    }
}
