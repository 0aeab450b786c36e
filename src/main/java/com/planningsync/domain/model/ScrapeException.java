package com.planningsync.domain.model;

/**
 * Checked failure raised by the scrape pipeline, tagged with its kind.
 */
public class ScrapeException extends Exception {

    private final ScrapeErrorKind kind;

    public ScrapeException(ScrapeErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ScrapeException(ScrapeErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ScrapeException containerUnavailable(String message, Throwable cause) {
        return new ScrapeException(ScrapeErrorKind.CONTAINER_UNAVAILABLE, message, cause);
    }

    public static ScrapeException paginationNotFound(String label) {
        return new ScrapeException(ScrapeErrorKind.PAGINATION_NOT_FOUND,
            "No pagination control labeled " + label);
    }

    public static ScrapeException pageAccess(String message, Throwable cause) {
        return new ScrapeException(ScrapeErrorKind.PAGE_ACCESS, message, cause);
    }

    public static ScrapeException malformedEventText(String message) {
        return new ScrapeException(ScrapeErrorKind.MALFORMED_EVENT_TEXT, message);
    }

    public static ScrapeException geometryOutOfRange(String message) {
        return new ScrapeException(ScrapeErrorKind.GEOMETRY_OUT_OF_RANGE, message);
    }

    public ScrapeErrorKind getKind() {
        return kind;
    }
}
