package com.planningsync.infrastructure.persistence;

import com.planningsync.domain.model.CalendarEvent;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NormalizationUtils.
 */
class NormalizationUtilsTest {

    @Test
    void testNormalizeText() {
        // Test uppercase conversion
        assertEquals("ANGLAIS", NormalizationUtils.normalizeText("anglais"));

        // Test accent removal
        assertEquals("MICROECONOMIE", NormalizationUtils.normalizeText("Microéconomie"));

        // Test space to underscore
        assertEquals("AMPHI_A", NormalizationUtils.normalizeText("Amphi A"));

        // Test special character removal
        assertEquals("FINANCE_MARCHES", NormalizationUtils.normalizeText("Finance & Marchés"));

        // Test leading/trailing removal
        assertEquals("MB_12", NormalizationUtils.normalizeText(" MB-12 "));
    }

    @Test
    void testGenerateNormalizedId() {
        CalendarEvent event = new CalendarEvent(LocalDateTime.of(2026, 10, 21, 8, 30), 90,
            "Microéconomie", "Amphi A", "Dupont J.", List.of("L3 ECO"), "");

        assertEquals("MICROECONOMIE-20261021T0830-AMPHI_A", NormalizationUtils.generateNormalizedId(event));
    }

    @Test
    void testNormalizeTextWithNullOrEmpty() {
        assertEquals("", NormalizationUtils.normalizeText(null));
        assertEquals("", NormalizationUtils.normalizeText(""));
        assertEquals("", NormalizationUtils.normalizeText("   "));
    }
}
