package com.planningsync.domain.model;

/**
 * Temporal layout of the timetable grid: how many day columns it spans and
 * which hours its rows cover. Rows are half-hour slots.
 *
 * @param dayCount  number of day columns, starting on Monday
 * @param startHour hour of day at the top edge of the grid
 * @param endHour   hour of day at the bottom edge of the grid
 */
public record GridLayout(int dayCount, int startHour, int endHour) {

    public static final int SLOT_MINUTES = 30;

    /** Monday to Sunday, 07:00 to 21:00. */
    public static final GridLayout DEFAULT = new GridLayout(7, 7, 21);

    public GridLayout {
        if (dayCount <= 0) {
            throw new IllegalArgumentException("dayCount must be positive: " + dayCount);
        }
        if (startHour < 0 || endHour > 24 || endHour <= startHour) {
            throw new IllegalArgumentException(
                "Invalid hour span " + startHour + "-" + endHour);
        }
    }

    public int halfHourSlots() {
        return (endHour - startHour) * 60 / SLOT_MINUTES;
    }
}
