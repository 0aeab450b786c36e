package com.planningsync.domain.model;

import java.time.LocalDateTime;

/**
 * Result of decoding one block's geometry.
 *
 * @param weekdayOffset     day column index, 0 for Monday
 * @param timeOffsetMinutes minutes from the top of the grid
 * @param durationMinutes   length of the block in minutes
 * @param start             absolute start, anchor and corrections applied
 */
public record DecodedSlot(
    int weekdayOffset,
    int timeOffsetMinutes,
    int durationMinutes,
    LocalDateTime start
) {

    /**
     * Whether the slot fits inside the grid it was decoded against.
     */
    public boolean isWithin(GridContainer container) {
        int gridMinutes = container.halfHourSlots() * GridLayout.SLOT_MINUTES;
        return weekdayOffset >= 0
            && weekdayOffset < container.dayCount()
            && timeOffsetMinutes >= 0
            && durationMinutes > 0
            && timeOffsetMinutes + durationMinutes <= gridMinutes;
    }
}
