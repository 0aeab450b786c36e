package com.planningsync.domain.model;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;

/**
 * Reference point shared by every week of a run: the Monday of the week the
 * run started in, at the grid's first hour.
 *
 * @param mondayStart Monday of the anchor week at the grid's start hour
 */
public record ScrapeAnchor(LocalDateTime mondayStart) {

    public ScrapeAnchor {
        if (mondayStart == null || mondayStart.getDayOfWeek() != DayOfWeek.MONDAY) {
            throw new IllegalArgumentException("Anchor must fall on a Monday: " + mondayStart);
        }
    }

    public static ScrapeAnchor at(LocalDate today, int startHour) {
        LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return new ScrapeAnchor(LocalDateTime.of(monday, LocalTime.of(startHour, 0)));
    }

    public static ScrapeAnchor now(Clock clock, int startHour) {
        return at(LocalDate.now(clock), startHour);
    }

    public int currentIsoWeek() {
        return mondayStart.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    /**
     * Target for the week {@code weekDelta} weeks after the anchor. The ISO week
     * is read from the shifted date so it rolls over 52/53 into week 1.
     */
    public WeekTarget target(int weekDelta) {
        int isoWeek = mondayStart.plusWeeks(weekDelta).get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        return new WeekTarget(isoWeek, weekDelta);
    }
}
