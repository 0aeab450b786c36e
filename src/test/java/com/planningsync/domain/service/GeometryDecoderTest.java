package com.planningsync.domain.service;

import com.planningsync.domain.model.DecodedSlot;
import com.planningsync.domain.model.GridContainer;
import com.planningsync.domain.model.GridLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GeometryDecoder.
 */
class GeometryDecoderTest {

    private static final LocalDateTime MONDAY_7AM = LocalDateTime.of(2026, 10, 19, 7, 0);

    private GeometryDecoder decoder;
    private GridContainer container;

    @BeforeEach
    void setUp() {
        decoder = new GeometryDecoder();
        // 100 px per day, 20 px per half hour
        container = new GridContainer(700, 560, GridLayout.DEFAULT);
    }

    @Test
    void testReferenceCell() {
        DecodedSlot slot = decoder.decode(container, 250, 100, 60, 0, MONDAY_7AM);

        assertEquals(2, slot.weekdayOffset());
        assertEquals(150, slot.timeOffsetMinutes());
        assertEquals(90, slot.durationMinutes());

        // Wednesday 07:00 + 2h30 - 1h
        assertEquals(LocalDateTime.of(2026, 10, 21, 8, 30), slot.start());
        assertEquals(DayOfWeek.WEDNESDAY, slot.start().getDayOfWeek());
        assertTrue(slot.isWithin(container));
    }

    @Test
    void testDecodingIsIdempotent() {
        DecodedSlot first = decoder.decode(container, 250, 100, 60, 1, MONDAY_7AM);
        DecodedSlot second = decoder.decode(container, 250, 100, 60, 1, MONDAY_7AM);

        assertEquals(first, second);
    }

    @Test
    void testWeekDeltaShiftsBySevenDays() {
        DecodedSlot slot = decoder.decode(container, 250, 100, 60, 2, MONDAY_7AM);

        assertEquals(LocalDateTime.of(2026, 11, 4, 8, 30), slot.start());
    }

    @Test
    void testPartialSlotsAreTruncated() {
        // 99 px is still Monday, 39 px is one slot, 59 px is two slots
        DecodedSlot slot = decoder.decode(container, 99, 39, 59, 0, MONDAY_7AM);

        assertEquals(0, slot.weekdayOffset());
        assertEquals(30, slot.timeOffsetMinutes());
        assertEquals(60, slot.durationMinutes());
        assertEquals(LocalDateTime.of(2026, 10, 19, 6, 30), slot.start());
    }

    @Test
    void testCustomCorrection() {
        GeometryDecoder uncorrected = new GeometryDecoder(Duration.ZERO);

        DecodedSlot slot = uncorrected.decode(container, 0, 0, 40, 0, MONDAY_7AM);

        assertEquals(MONDAY_7AM, slot.start());
    }

    @Test
    void testColumnBeyondGridIsOutOfRange() {
        DecodedSlot slot = decoder.decode(container, 750, 100, 60, 0, MONDAY_7AM);

        assertEquals(7, slot.weekdayOffset());
        assertFalse(slot.isWithin(container));
    }

    @Test
    void testBlockRunningPastGridEndIsOutOfRange() {
        // starts at 20:30 and lasts 90 minutes
        DecodedSlot slot = decoder.decode(container, 0, 540, 60, 0, MONDAY_7AM);

        assertFalse(slot.isWithin(container));
    }

    @Test
    void testZeroDurationIsOutOfRange() {
        DecodedSlot slot = decoder.decode(container, 0, 0, 10, 0, MONDAY_7AM);

        assertEquals(0, slot.durationMinutes());
        assertFalse(slot.isWithin(container));
    }

    @Test
    void testNegativeOffsetIsOutOfRange() {
        DecodedSlot slot = decoder.decode(container, 0, -40, 40, 0, MONDAY_7AM);

        assertFalse(slot.isWithin(container));
    }
}
