package com.planningsync.infrastructure.scraper.ade;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads pixel values out of inline {@code style} attributes such as
 * {@code "position: absolute; left: 250px; top: 100px"}.
 */
public final class CssStyleParser {

    private CssStyleParser() {
    }

    /**
     * Returns the value of {@code property} in whole pixels, truncating any
     * fractional part.
     *
     * @return the pixel value, or null if the property is absent or not in px
     */
    public static Integer pixels(String style, String property) {
        if (style == null || style.isBlank()) {
            return null;
        }
        Pattern pattern = Pattern.compile(
            "(?:^|;)\\s*" + Pattern.quote(property) + "\\s*:\\s*(-?\\d+)(?:\\.\\d+)?\\s*px",
            Pattern.CASE_INSENSITIVE);
        Matcher matcher = pattern.matcher(style);
        if (!matcher.find()) {
            return null;
        }
        return Integer.parseInt(matcher.group(1));
    }
}
