package com.planningsync.infrastructure.rest;

import com.planningsync.application.usecase.SyncTimetableUseCase;
import com.planningsync.domain.model.ScrapeErrorKind;
import com.planningsync.domain.model.ScrapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for timetable operations.
 */
@RestController
@RequestMapping("/timetable")
public class TimetableController {

    private static final Logger logger = LoggerFactory.getLogger(TimetableController.class);

    private final SyncTimetableUseCase syncTimetableUseCase;

    public TimetableController(SyncTimetableUseCase syncTimetableUseCase) {
        this.syncTimetableUseCase = syncTimetableUseCase;
    }

    /**
     * Endpoint to scrape and publish the timetable now.
     *
     * POST /timetable/refresh
     *
     * @return Summary of the sync
     */
    @PostMapping("/refresh")
    public ResponseEntity<SyncTimetableUseCase.SyncSummary> refresh() {
        logger.info("Received request to refresh the timetable");

        try {
            SyncTimetableUseCase.SyncSummary summary = syncTimetableUseCase.execute();
            logger.info("Timetable refresh completed. Published: {}", summary.publishedByPublisher());

            return ResponseEntity.ok(summary);
        } catch (ScrapeException e) {
            logger.error("Timetable refresh aborted", e);
            HttpStatus status = e.getKind() == ScrapeErrorKind.CONTAINER_UNAVAILABLE
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.INTERNAL_SERVER_ERROR;
            return ResponseEntity.status(status).build();
        } catch (Exception e) {
            logger.error("Error refreshing the timetable", e);
            return ResponseEntity.internalServerError().build();
        }
    }
}
