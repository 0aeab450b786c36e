package com.planningsync.domain.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A normalized timetable event, ready to be published.
 *
 * @param start           local start date-time
 * @param durationMinutes length of the event, a multiple of 30
 * @param course          course title
 * @param room            room label
 * @param instructor      instructor name(s)
 * @param groups          group tags in source order, possibly empty
 * @param notes           free-text notes
 */
public record CalendarEvent(
    LocalDateTime start,
    int durationMinutes,
    String course,
    String room,
    String instructor,
    List<String> groups,
    String notes
) {

    public CalendarEvent {
        if (start == null) {
            throw new IllegalArgumentException("start is required");
        }
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public static CalendarEvent of(DecodedSlot slot, EventRecord record) {
        return new CalendarEvent(
            slot.start(),
            slot.durationMinutes(),
            record.course(),
            record.room(),
            record.instructor(),
            record.groups(),
            record.notes()
        );
    }

    public LocalDateTime end() {
        return start.plusMinutes(durationMinutes);
    }
}
