package com.planningsync.domain.ports;

import com.planningsync.domain.model.GridContainer;
import com.planningsync.domain.model.RawCell;
import com.planningsync.domain.model.ScrapeException;

import java.util.List;

/**
 * Port for one exclusive session on the rendered planning page.
 * A session is owned by a single worker and closed by whoever opened it.
 */
public interface PageAccessor extends AutoCloseable {

    /**
     * Reads the pixel dimensions of the timetable grid.
     *
     * @return the grid container
     * @throws ScrapeException if the container cannot be located or measured
     */
    GridContainer getContainerDimensions() throws ScrapeException;

    /**
     * Activates the pagination control whose text contains {@code label}.
     *
     * @param label week label, e.g. "(42)"
     * @throws ScrapeException with kind PAGINATION_NOT_FOUND when no control matches
     */
    void activateWeek(String label) throws ScrapeException;

    /**
     * Lists the event blocks rendered for the currently displayed week.
     *
     * @return the cells, empty when the week has no events
     * @throws ScrapeException if the page cannot be read
     */
    List<RawCell> listEventCells() throws ScrapeException;

    @Override
    void close();
}
