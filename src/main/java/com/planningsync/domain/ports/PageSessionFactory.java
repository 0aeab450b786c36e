package com.planningsync.domain.ports;

import com.planningsync.domain.model.ScrapeException;

/**
 * Port for opening independent page sessions, one per concurrent worker.
 */
public interface PageSessionFactory {

    /**
     * Opens a new session with the planning page loaded on the current week.
     *
     * @return an open session, to be closed by the caller
     * @throws ScrapeException if the page cannot be loaded
     */
    PageAccessor openSession() throws ScrapeException;
}
