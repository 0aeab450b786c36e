package com.planningsync.infrastructure.scraper.ade;

import com.planningsync.application.usecase.WeekScrapeWorker;
import com.planningsync.domain.model.CalendarEvent;
import com.planningsync.domain.model.GridContainer;
import com.planningsync.domain.model.GridLayout;
import com.planningsync.domain.model.RawCell;
import com.planningsync.domain.model.ScrapeErrorKind;
import com.planningsync.domain.model.ScrapeException;
import com.planningsync.domain.model.WeekOutcome;
import com.planningsync.domain.model.WeekTarget;
import com.planningsync.domain.service.EventTextParser;
import com.planningsync.domain.service.GeometryDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AdePlanningPage against saved planning pages.
 */
class AdePlanningPageTest {

    private static final String BASE_URL = "https://ade.example.org/direct/planning.jsp";

    private static final Map<String, String> PAGES = Map.of(
        BASE_URL, "/ade/week-43.html",
        BASE_URL + "?week=44", "/ade/week-44.html",
        BASE_URL + "?week=45", "/ade/week-45.html",
        "https://ade.example.org/login", "/ade/no-grid.html"
    );

    private List<String> requested;
    private AdePlanningPage.PageLoader loader;

    @BeforeEach
    void setUp() {
        requested = new ArrayList<>();
        loader = url -> {
            requested.add(url);
            String resource = PAGES.get(url);
            if (resource == null) {
                throw new IOException("404 " + url);
            }
            try (InputStream in = AdePlanningPageTest.class.getResourceAsStream(resource)) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        };
    }

    @Test
    void testContainerDimensions() throws ScrapeException {
        AdePlanningPage page = new AdePlanningPage(loader, GridLayout.DEFAULT, BASE_URL);

        GridContainer container = page.getContainerDimensions();

        assertEquals(700, container.widthPx());
        assertEquals(560, container.heightPx());
        assertEquals(7, container.dayCount());
    }

    @Test
    void testListEventCells() throws ScrapeException {
        AdePlanningPage page = new AdePlanningPage(loader, GridLayout.DEFAULT, BASE_URL);

        List<RawCell> cells = page.listEventCells();

        // the now-marker is not an event block
        assertEquals(3, cells.size());
        RawCell first = cells.get(0);
        assertEquals(250, first.xPx());
        assertEquals(100, first.yPx());
        assertEquals(60, first.blockHeightPx());
        assertTrue(first.textBlob().startsWith("<div class=\"eventText\"><b>Microéconomie</b>"));
        assertEquals(80, cells.get(1).blockHeightPx());
        assertTrue(first.hasGeometry());
    }

    @Test
    void testBlockWithoutPositionIsKept() throws ScrapeException {
        AdePlanningPage page = new AdePlanningPage(loader, GridLayout.DEFAULT, BASE_URL);

        RawCell cell = page.listEventCells().get(2);

        assertFalse(cell.hasGeometry());
        assertTrue(cell.unreadableGeometry().contains("height:40px"), cell.unreadableGeometry());
        assertTrue(cell.textBlob().contains("Sans position"));
    }

    @Test
    void testActivateWeekFollowsLink() throws ScrapeException {
        AdePlanningPage page = new AdePlanningPage(loader, GridLayout.DEFAULT, BASE_URL);

        page.activateWeek("(44)");

        assertEquals(BASE_URL + "?week=44", requested.get(1));
        List<RawCell> cells = page.listEventCells();
        assertEquals(1, cells.size());
        assertEquals(410, cells.get(0).xPx());
    }

    @Test
    void testActivateWeekFollowsDataHref() throws ScrapeException {
        AdePlanningPage page = new AdePlanningPage(loader, GridLayout.DEFAULT, BASE_URL);

        page.activateWeek("(45)");

        assertTrue(page.listEventCells().isEmpty());
    }

    @Test
    void testActivateWeekWithoutControl() throws ScrapeException {
        AdePlanningPage page = new AdePlanningPage(loader, GridLayout.DEFAULT, BASE_URL);

        ScrapeException e = assertThrows(ScrapeException.class, () -> page.activateWeek("(47)"));

        assertEquals(ScrapeErrorKind.PAGINATION_NOT_FOUND, e.getKind());
    }

    @Test
    void testActivateWeekWithoutTarget() throws ScrapeException {
        AdePlanningPage page = new AdePlanningPage(loader, GridLayout.DEFAULT, BASE_URL);

        ScrapeException e = assertThrows(ScrapeException.class, () -> page.activateWeek("(46)"));

        assertEquals(ScrapeErrorKind.PAGE_ACCESS, e.getKind());
    }

    @Test
    void testMissingGrid() throws ScrapeException {
        AdePlanningPage page = new AdePlanningPage(loader, GridLayout.DEFAULT, "https://ade.example.org/login");

        ScrapeException e = assertThrows(ScrapeException.class, page::getContainerDimensions);

        assertEquals(ScrapeErrorKind.CONTAINER_UNAVAILABLE, e.getKind());
    }

    @Test
    void testLoadFailure() {
        ScrapeException e = assertThrows(ScrapeException.class,
            () -> new AdePlanningPage(loader, GridLayout.DEFAULT, "https://ade.example.org/missing"));

        assertEquals(ScrapeErrorKind.PAGE_ACCESS, e.getKind());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void testClosedSession() throws ScrapeException {
        AdePlanningPage page = new AdePlanningPage(loader, GridLayout.DEFAULT, BASE_URL);
        page.close();

        assertThrows(ScrapeException.class, page::listEventCells);
    }

    @Test
    void testWorkerOnSavedPage() throws ScrapeException {
        AdePlanningPage page = new AdePlanningPage(loader, GridLayout.DEFAULT, BASE_URL);
        GridContainer container = page.getContainerDimensions();
        WeekScrapeWorker worker = new WeekScrapeWorker(new GeometryDecoder(), new EventTextParser());

        WeekOutcome outcome = worker.run(page, container, new WeekTarget(43, 0),
            LocalDateTime.of(2026, 10, 19, 7, 0));

        assertEquals(2, outcome.events().size());
        assertEquals(1, outcome.diagnostics().size());
        assertEquals(2, outcome.diagnostics().get(0).cellIndex());
        assertEquals(ScrapeErrorKind.GEOMETRY_OUT_OF_RANGE, outcome.diagnostics().get(0).kind());

        CalendarEvent micro = outcome.events().get(0);
        assertEquals("Microéconomie", micro.course());
        assertEquals("Amphi A", micro.room());
        assertEquals("Dupont J.", micro.instructor());
        assertEquals(List.of("L3 ECO", "TD1"), micro.groups());
        assertEquals("Contrôle continu", micro.notes());
        assertEquals(LocalDateTime.of(2026, 10, 21, 8, 30), micro.start());
        assertEquals(90, micro.durationMinutes());

        CalendarEvent droit = outcome.events().get(1);
        assertEquals(LocalDateTime.of(2026, 10, 19, 6, 0), droit.start());
        assertEquals(120, droit.durationMinutes());
    }
}
