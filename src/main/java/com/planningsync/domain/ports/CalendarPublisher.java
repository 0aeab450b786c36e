package com.planningsync.domain.ports;

import com.planningsync.domain.model.AssembledCalendar;

/**
 * Port for delivering an assembled calendar to an external destination.
 */
public interface CalendarPublisher {

    /**
     * Gets the name of this publisher.
     *
     * @return Publisher name (e.g., "ics", "mongodb")
     */
    String getPublisherName();

    /**
     * Publishes the calendar.
     *
     * @param calendar Calendar to publish
     * @return Number of events written
     * @throws Exception if publishing fails
     */
    int publish(AssembledCalendar calendar) throws Exception;
}
