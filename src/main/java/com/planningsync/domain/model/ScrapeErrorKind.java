package com.planningsync.domain.model;

/**
 * Failure categories raised while scraping, with the level they are contained at.
 */
public enum ScrapeErrorKind {
    /** No grid container could be read. Aborts the run. */
    CONTAINER_UNAVAILABLE,
    /** No pagination control for the requested week. Fails that week. */
    PAGINATION_NOT_FOUND,
    /** Page session or transport failure. Fails that week. */
    PAGE_ACCESS,
    /** Worker exceeded its time budget. Fails that week. */
    TIMEOUT,
    /** Text blob does not carry the expected segments. Skips that cell. */
    MALFORMED_EVENT_TEXT,
    /** Geometry decodes outside the grid. Skips that cell. */
    GEOMETRY_OUT_OF_RANGE
}
