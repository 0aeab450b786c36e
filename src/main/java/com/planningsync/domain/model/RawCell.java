package com.planningsync.domain.model;

/**
 * One event block as scraped from the page, before any decoding.
 *
 * @param xPx                left offset of the block inside the grid container
 * @param yPx                top offset of the block inside the grid container
 * @param blockHeightPx      rendered height of the block
 * @param textBlob           inner markup of the block's text area
 * @param unreadableGeometry why the position could not be read, null when it could
 */
public record RawCell(int xPx, int yPx, int blockHeightPx, String textBlob, String unreadableGeometry) {

    public RawCell(int xPx, int yPx, int blockHeightPx, String textBlob) {
        this(xPx, yPx, blockHeightPx, textBlob, null);
    }

    /**
     * A block whose position could not be read. Decoding it always fails.
     */
    public static RawCell unreadable(String textBlob, String reason) {
        return new RawCell(0, 0, 0, textBlob, reason);
    }

    public boolean hasGeometry() {
        return unreadableGeometry == null;
    }
}
