package com.planningsync.application.usecase;

import com.planningsync.domain.model.AssembledCalendar;
import com.planningsync.domain.model.ScrapeDiagnostic;
import com.planningsync.domain.model.ScrapeException;
import com.planningsync.domain.model.ScrapeReport;
import com.planningsync.domain.model.WeekOutcome;
import com.planningsync.domain.ports.CalendarPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Use case for scraping the timetable and publishing it to every publisher.
 */
public class SyncTimetableUseCase {

    private static final Logger logger = LoggerFactory.getLogger(SyncTimetableUseCase.class);

    private final ScrapeOrchestrator orchestrator;
    private final CalendarAssembler assembler;
    private final List<CalendarPublisher> publishers;
    private final int weekCount;

    public SyncTimetableUseCase(
            ScrapeOrchestrator orchestrator,
            CalendarAssembler assembler,
            List<CalendarPublisher> publishers,
            int weekCount) {
        this.orchestrator = orchestrator;
        this.assembler = assembler;
        this.publishers = publishers;
        this.weekCount = weekCount;
    }

    /**
     * Scrapes the configured number of weeks, assembles the calendar and
     * publishes it.
     *
     * @return Summary of the sync
     * @throws ScrapeException if the grid container cannot be read
     */
    public SyncSummary execute() throws ScrapeException {
        long startedAt = System.currentTimeMillis();
        logger.info("Starting timetable sync for {} weeks with {} publishers", weekCount, publishers.size());

        ScrapeReport report = orchestrator.run(weekCount);
        AssembledCalendar calendar = assembler.assemble(report.events());
        logger.info("Assembled calendar with {} events", calendar.size());

        Map<Integer, Integer> eventsByWeek = new LinkedHashMap<>();
        for (WeekOutcome week : report.weeks()) {
            if (!week.failed()) {
                eventsByWeek.put(week.target().isoWeek(), week.events().size());
            }
        }

        Map<String, Integer> publishedByPublisher = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        for (CalendarPublisher publisher : publishers) {
            String name = publisher.getPublisherName();
            try {
                int published = publisher.publish(calendar);
                publishedByPublisher.put(name, published);
                logger.info("Publisher {} wrote {} events", name, published);
            } catch (Exception e) {
                logger.error("Publisher {} failed", name, e);
                errors.put(name, e.getMessage());
            }
        }

        long elapsedMillis = System.currentTimeMillis() - startedAt;
        logger.info("Timetable sync took {} ms", elapsedMillis);

        return new SyncSummary(
            eventsByWeek,
            new ArrayList<>(report.diagnostics()),
            errors,
            publishedByPublisher,
            elapsedMillis
        );
    }

    public record SyncSummary(
        Map<Integer, Integer> eventsByWeek,
        List<ScrapeDiagnostic> diagnostics,
        Map<String, String> publisherErrors,
        Map<String, Integer> publishedByPublisher,
        long elapsedMillis
    ) {}
}
