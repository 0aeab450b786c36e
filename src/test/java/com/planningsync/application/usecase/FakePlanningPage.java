package com.planningsync.application.usecase;

import com.planningsync.domain.model.GridContainer;
import com.planningsync.domain.model.GridLayout;
import com.planningsync.domain.model.RawCell;
import com.planningsync.domain.model.ScrapeException;
import com.planningsync.domain.ports.PageAccessor;
import com.planningsync.domain.ports.PageSessionFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory planning page. Weeks are keyed by ISO week number; a week missing
 * from the map has no pagination control.
 */
class FakePlanningPage implements PageAccessor {

    static final GridContainer CONTAINER = new GridContainer(700, 560, GridLayout.DEFAULT);

    private final Map<Integer, List<RawCell>> cellsByWeek;
    private final Set<Integer> brokenWeeks;
    private final Map<Integer, Long> slowWeeks;
    private final Factory factory;
    private int displayedWeek;
    final List<String> activatedLabels = new ArrayList<>();
    boolean closed;

    FakePlanningPage(int currentWeek, Map<Integer, List<RawCell>> cellsByWeek) {
        this(currentWeek, cellsByWeek, Set.of(), Map.of(), null);
    }

    private FakePlanningPage(int currentWeek, Map<Integer, List<RawCell>> cellsByWeek,
                             Set<Integer> brokenWeeks, Map<Integer, Long> slowWeeks, Factory factory) {
        this.displayedWeek = currentWeek;
        this.cellsByWeek = cellsByWeek;
        this.brokenWeeks = brokenWeeks;
        this.slowWeeks = slowWeeks;
        this.factory = factory;
    }

    static RawCell cell(int day, String course) {
        return new RawCell(day * 100 + 10, 100, 60, blob(course, "Amphi A", "Dupont J.", "Notes"));
    }

    static String blob(String title, String... lines) {
        StringBuilder sb = new StringBuilder("<div class=\"eventText\"><b>").append(title).append("</b>");
        for (String line : lines) {
            sb.append("<br>").append(line);
        }
        return sb.append("<br></div>").toString();
    }

    @Override
    public GridContainer getContainerDimensions() throws ScrapeException {
        if (factory != null && factory.containerBroken) {
            throw ScrapeException.pageAccess("grid not rendered", null);
        }
        return CONTAINER;
    }

    @Override
    public void activateWeek(String label) throws ScrapeException {
        activatedLabels.add(label);
        int week = Integer.parseInt(label.substring(1, label.length() - 1));
        if (!cellsByWeek.containsKey(week)) {
            throw ScrapeException.paginationNotFound(label);
        }
        displayedWeek = week;
    }

    @Override
    public List<RawCell> listEventCells() throws ScrapeException {
        if (factory != null) {
            int running = factory.inFlight.incrementAndGet();
            factory.maxInFlight.accumulateAndGet(running, Math::max);
        }
        try {
            Long delay = slowWeeks.get(displayedWeek);
            if (delay != null) {
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw ScrapeException.pageAccess("interrupted", e);
                }
            }
            if (brokenWeeks.contains(displayedWeek)) {
                throw ScrapeException.pageAccess("page crashed on week " + displayedWeek, null);
            }
            return cellsByWeek.getOrDefault(displayedWeek, List.of());
        } finally {
            if (factory != null) {
                factory.inFlight.decrementAndGet();
            }
        }
    }

    @Override
    public void close() {
        if (!closed && factory != null) {
            factory.closed.incrementAndGet();
        }
        closed = true;
    }

    /**
     * Opens a fresh page per session and counts sessions.
     */
    static class Factory implements PageSessionFactory {

        final Map<Integer, List<RawCell>> cellsByWeek = new HashMap<>();
        final Map<Integer, Long> slowWeeks = new HashMap<>();
        final Set<Integer> brokenWeeks = new HashSet<>();
        final AtomicInteger opened = new AtomicInteger();
        final AtomicInteger closed = new AtomicInteger();
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        private final int currentWeek;
        boolean containerBroken;
        boolean unreachable;

        Factory(int currentWeek) {
            this.currentWeek = currentWeek;
        }

        @Override
        public PageAccessor openSession() throws ScrapeException {
            if (unreachable) {
                throw ScrapeException.pageAccess("connection refused", null);
            }
            opened.incrementAndGet();
            return new FakePlanningPage(currentWeek, cellsByWeek, brokenWeeks, slowWeeks, this);
        }
    }
}
