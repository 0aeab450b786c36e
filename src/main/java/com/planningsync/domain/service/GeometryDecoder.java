package com.planningsync.domain.service;

import com.planningsync.domain.model.DecodedSlot;
import com.planningsync.domain.model.GridContainer;
import com.planningsync.domain.model.GridLayout;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Converts an event block's pixel geometry into a start date-time and a duration.
 *
 * Rules:
 * 1. Day column = x / dayPx
 * 2. Start offset = (y / halfHourPx) half-hour slots
 * 3. Duration = (height / halfHourPx) half-hour slots
 * 4. Start = anchor + day + offset + 7 days per week delta + correction
 *
 * All divisions are integer divisions. No bounds are checked here; see
 * {@link DecodedSlot#isWithin(GridContainer)}.
 */
public class GeometryDecoder {

    /** Page times are rendered one hour ahead of the published calendar. */
    public static final Duration DEFAULT_CORRECTION = Duration.ofHours(-1);

    private final Duration correction;

    public GeometryDecoder() {
        this(DEFAULT_CORRECTION);
    }

    public GeometryDecoder(Duration correction) {
        this.correction = correction == null ? Duration.ZERO : correction;
    }

    public DecodedSlot decode(GridContainer container, int xPx, int yPx, int blockHeightPx,
                              int weekDelta, LocalDateTime anchorMondayStart) {
        int weekdayOffset = xPx / container.dayPx();
        int timeOffsetMinutes = (yPx / container.halfHourPx()) * GridLayout.SLOT_MINUTES;
        int durationMinutes = (blockHeightPx / container.halfHourPx()) * GridLayout.SLOT_MINUTES;

        LocalDateTime start = anchorMondayStart
            .plusDays(weekdayOffset)
            .plusMinutes(timeOffsetMinutes)
            .plusDays(weekDelta * 7L)
            .plus(correction);

        return new DecodedSlot(weekdayOffset, timeOffsetMinutes, durationMinutes, start);
    }
}
