package com.planningsync.infrastructure.config;

import com.planningsync.application.usecase.CalendarAssembler;
import com.planningsync.application.usecase.ScrapeOrchestrator;
import com.planningsync.application.usecase.SyncTimetableUseCase;
import com.planningsync.application.usecase.WeekScrapeWorker;
import com.planningsync.domain.model.GridLayout;
import com.planningsync.domain.ports.CalendarPublisher;
import com.planningsync.domain.ports.PageSessionFactory;
import com.planningsync.domain.service.EventTextParser;
import com.planningsync.domain.service.GeometryDecoder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wiring for the scrape pipeline.
 */
@Configuration
@EnableConfigurationProperties(TimetableProperties.class)
public class TimetableConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public GridLayout gridLayout(TimetableProperties properties) {
        return properties.toGridLayout();
    }

    @Bean
    public GeometryDecoder geometryDecoder(TimetableProperties properties) {
        return new GeometryDecoder(properties.getTimezoneCorrection());
    }

    @Bean
    public EventTextParser eventTextParser() {
        return new EventTextParser();
    }

    @Bean
    public WeekScrapeWorker weekScrapeWorker(GeometryDecoder geometryDecoder, EventTextParser eventTextParser) {
        return new WeekScrapeWorker(geometryDecoder, eventTextParser);
    }

    @Bean
    public ScrapeOrchestrator scrapeOrchestrator(
            PageSessionFactory pageSessionFactory,
            WeekScrapeWorker weekScrapeWorker,
            TimetableProperties properties,
            Clock clock) {
        return new ScrapeOrchestrator(
            pageSessionFactory,
            weekScrapeWorker,
            properties.getMaxConcurrency(),
            properties.getWorkerTimeout(),
            clock,
            properties.getStartHour()
        );
    }

    @Bean
    public CalendarAssembler calendarAssembler(Clock clock) {
        return new CalendarAssembler(clock);
    }

    @Bean
    public SyncTimetableUseCase syncTimetableUseCase(
            ScrapeOrchestrator scrapeOrchestrator,
            CalendarAssembler calendarAssembler,
            List<CalendarPublisher> publishers,
            TimetableProperties properties) {
        return new SyncTimetableUseCase(scrapeOrchestrator, calendarAssembler, publishers, properties.getWeekCount());
    }
}
