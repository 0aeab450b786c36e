package com.planningsync.infrastructure.persistence;

import com.planningsync.domain.model.CalendarEvent;

import java.text.Normalizer;
import java.time.format.DateTimeFormatter;

/**
 * Utilities for deriving stable event identifiers.
 */
public class NormalizationUtils {

    private static final DateTimeFormatter NORMALIZED_DATE_FORMATTER =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmm");

    private NormalizationUtils() {
    }

    /**
     * Normalizes text for use in normalized IDs.
     *
     * Rules:
     * 1. Convert to uppercase
     * 2. Remove accents (Amphithéâtre -> AMPHITHEATRE)
     * 3. Replace non-alphanumeric with underscore
     * 4. Collapse multiple underscores
     * 5. Remove leading/trailing underscores
     */
    public static String normalizeText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return "";
        }

        // Remove accents
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFD);
        normalized = normalized.replaceAll("\\p{M}", "");

        normalized = normalized.toUpperCase();
        normalized = normalized.replaceAll("[^A-Z0-9]+", "_");
        normalized = normalized.replaceAll("_+", "_");
        normalized = normalized.replaceAll("^_+|_+$", "");

        return normalized;
    }

    /**
     * Generates a normalized ID for an event.
     *
     * Format: <COURSE>-<START>-<ROOM>
     * Example: MICROECONOMIE-20261021T0830-AMPHI_A
     */
    public static String generateNormalizedId(CalendarEvent event) {
        return String.format("%s-%s-%s",
            normalizeText(event.course()),
            event.start().format(NORMALIZED_DATE_FORMATTER),
            normalizeText(event.room()));
    }
}
