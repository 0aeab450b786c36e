package com.planningsync.infrastructure.scheduler;

import com.planningsync.application.usecase.SyncTimetableUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-syncs the timetable on a fixed delay.
 */
@Component
@ConditionalOnProperty(prefix = "timetable", name = "refresh-enabled", havingValue = "true", matchIfMissing = true)
public class TimetableRefreshJob {

    private static final Logger logger = LoggerFactory.getLogger(TimetableRefreshJob.class);

    private final SyncTimetableUseCase syncTimetableUseCase;

    public TimetableRefreshJob(SyncTimetableUseCase syncTimetableUseCase) {
        this.syncTimetableUseCase = syncTimetableUseCase;
    }

    @Scheduled(initialDelayString = "${timetable.refresh-initial-delay:PT10S}",
               fixedDelayString = "${timetable.refresh-interval:PT6H}")
    public void refresh() {
        try {
            SyncTimetableUseCase.SyncSummary summary = syncTimetableUseCase.execute();
            logger.info("Scheduled refresh done: {} weeks, {} diagnostics, published {}",
                summary.eventsByWeek().size(), summary.diagnostics().size(), summary.publishedByPublisher());
        } catch (Exception e) {
            logger.error("Scheduled refresh failed, retrying at the next run", e);
        }
    }
}
