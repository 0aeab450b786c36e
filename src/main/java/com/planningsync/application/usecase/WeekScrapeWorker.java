package com.planningsync.application.usecase;

import com.planningsync.domain.model.CalendarEvent;
import com.planningsync.domain.model.DecodedSlot;
import com.planningsync.domain.model.EventRecord;
import com.planningsync.domain.model.GridContainer;
import com.planningsync.domain.model.RawCell;
import com.planningsync.domain.model.ScrapeDiagnostic;
import com.planningsync.domain.model.ScrapeException;
import com.planningsync.domain.model.WeekOutcome;
import com.planningsync.domain.model.WeekTarget;
import com.planningsync.domain.ports.PageAccessor;
import com.planningsync.domain.service.EventTextParser;
import com.planningsync.domain.service.GeometryDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Scrapes a single week through an exclusive page session.
 *
 * Flow:
 * 1) Activate the week's pagination control unless it is the current week
 * 2) Fetch the rendered event cells
 * 3) Decode and parse each cell, skipping the ones that fail
 */
public class WeekScrapeWorker {

    private static final Logger logger = LoggerFactory.getLogger(WeekScrapeWorker.class);

    private final GeometryDecoder geometryDecoder;
    private final EventTextParser textParser;

    public WeekScrapeWorker(GeometryDecoder geometryDecoder, EventTextParser textParser) {
        this.geometryDecoder = geometryDecoder;
        this.textParser = textParser;
    }

    /**
     * Runs the week.
     *
     * @param page      session owned by this worker for the duration of the call
     * @param container grid geometry shared by the whole run
     * @param target    week to scrape
     * @param anchor    Monday of the anchor week at the grid's start hour
     * @return the week's events plus diagnostics for skipped cells
     * @throws ScrapeException if the week cannot be navigated to or read
     */
    public WeekOutcome run(PageAccessor page, GridContainer container, WeekTarget target,
                           LocalDateTime anchor) throws ScrapeException {
        if (!target.isCurrentWeek()) {
            logger.info("Week {} navigating to pagination control {}", target.isoWeek(), target.paginationLabel());
            page.activateWeek(target.paginationLabel());
        }

        List<RawCell> cells = page.listEventCells();
        if (cells.isEmpty()) {
            logger.info("No events for week {}", target.isoWeek());
            return WeekOutcome.empty(target);
        }

        logger.info("Parsing {} cells for week {}", cells.size(), target.isoWeek());

        List<CalendarEvent> events = new ArrayList<>();
        List<ScrapeDiagnostic> diagnostics = new ArrayList<>();
        for (int i = 0; i < cells.size(); i++) {
            try {
                events.add(toEvent(cells.get(i), container, target, anchor));
            } catch (ScrapeException e) {
                logger.warn("Skipping cell {} of week {}: {}", i, target.isoWeek(), e.getMessage());
                diagnostics.add(ScrapeDiagnostic.forCell(target, i, e));
            }
        }

        logger.info("Week {} produced {} events ({} cells skipped)",
            target.isoWeek(), events.size(), diagnostics.size());
        return WeekOutcome.succeeded(target, events, diagnostics);
    }

    private CalendarEvent toEvent(RawCell cell, GridContainer container, WeekTarget target,
                                  LocalDateTime anchor) throws ScrapeException {
        if (!cell.hasGeometry()) {
            throw ScrapeException.geometryOutOfRange("Unreadable cell geometry: " + cell.unreadableGeometry());
        }

        DecodedSlot slot = geometryDecoder.decode(
            container, cell.xPx(), cell.yPx(), cell.blockHeightPx(), target.weekDelta(), anchor);

        if (!slot.isWithin(container)) {
            throw ScrapeException.geometryOutOfRange(String.format(
                "Cell at (%d, %d) height %d decodes to day %d, offset %d min, duration %d min",
                cell.xPx(), cell.yPx(), cell.blockHeightPx(),
                slot.weekdayOffset(), slot.timeOffsetMinutes(), slot.durationMinutes()));
        }

        EventRecord record = textParser.parse(cell.textBlob());
        logger.debug("Week {} cell decoded to {} '{}'", target.isoWeek(), slot.start(), record.course());
        return CalendarEvent.of(slot, record);
    }
}
