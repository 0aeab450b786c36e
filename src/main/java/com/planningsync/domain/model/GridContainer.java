package com.planningsync.domain.model;

/**
 * Pixel dimensions of the rendered timetable grid together with its layout.
 * Pixel-per-unit ratios are derived on demand and truncated to whole pixels.
 */
public record GridContainer(int widthPx, int heightPx, GridLayout layout) {

    public GridContainer {
        if (widthPx <= 0 || heightPx <= 0) {
            throw new IllegalArgumentException(
                "Container dimensions must be positive: " + widthPx + "x" + heightPx);
        }
        if (layout == null) {
            throw new IllegalArgumentException("layout is required");
        }
        if (widthPx / layout.dayCount() == 0 || heightPx / layout.halfHourSlots() == 0) {
            throw new IllegalArgumentException(
                "Container " + widthPx + "x" + heightPx + " is too small for layout " + layout);
        }
    }

    public int dayCount() {
        return layout.dayCount();
    }

    public int halfHourSlots() {
        return layout.halfHourSlots();
    }

    /** Width of one day column in pixels. */
    public int dayPx() {
        return widthPx / layout.dayCount();
    }

    /** Height of one half-hour row in pixels. */
    public int halfHourPx() {
        return heightPx / layout.halfHourSlots();
    }
}
