package com.planningsync.application.usecase;

import com.planningsync.domain.model.CalendarEvent;
import com.planningsync.domain.model.GridContainer;
import com.planningsync.domain.model.ScrapeAnchor;
import com.planningsync.domain.model.ScrapeErrorKind;
import com.planningsync.domain.model.ScrapeException;
import com.planningsync.domain.model.ScrapeReport;
import com.planningsync.domain.model.WeekOutcome;
import com.planningsync.domain.model.WeekTarget;
import com.planningsync.domain.ports.PageAccessor;
import com.planningsync.domain.ports.PageSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Scrapes consecutive weeks in parallel and merges the results.
 *
 * The grid container is read once from the first session and shared by every
 * worker. Each worker owns its own session. A failed week is reported and
 * dropped; only a failed container read aborts the run.
 */
public class ScrapeOrchestrator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScrapeOrchestrator.class);

    private final PageSessionFactory sessionFactory;
    private final WeekScrapeWorker worker;
    private final Duration workerTimeout;
    private final Clock clock;
    private final int startHour;
    private final ExecutorService executorService;

    public ScrapeOrchestrator(PageSessionFactory sessionFactory, WeekScrapeWorker worker,
                              int maxConcurrency, Duration workerTimeout, Clock clock, int startHour) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive: " + maxConcurrency);
        }
        this.sessionFactory = sessionFactory;
        this.worker = worker;
        this.workerTimeout = workerTimeout;
        this.clock = clock;
        this.startHour = startHour;
        this.executorService = Executors.newFixedThreadPool(maxConcurrency);
    }

    /**
     * Scrapes {@code weekCount} weeks starting with the current one.
     *
     * @param weekCount number of weeks, at least 1
     * @return merged events with per-week outcomes
     * @throws ScrapeException with kind CONTAINER_UNAVAILABLE if the grid cannot be read
     */
    public ScrapeReport run(int weekCount) throws ScrapeException {
        return run(weekCount, ScrapeAnchor.now(clock, startHour));
    }

    public ScrapeReport run(int weekCount, ScrapeAnchor anchor) throws ScrapeException {
        if (weekCount <= 0) {
            throw new IllegalArgumentException("weekCount must be positive: " + weekCount);
        }

        logger.info("Starting scrape of {} weeks from ISO week {}", weekCount, anchor.currentIsoWeek());

        PageAccessor firstSession = openFirstSession();
        GridContainer container = readContainer(firstSession);
        logger.info("Grid container {}x{} px ({} days, {} px/day, {} px/half-hour)",
            container.widthPx(), container.heightPx(), container.dayCount(),
            container.dayPx(), container.halfHourPx());

        List<WeekTarget> targets = new ArrayList<>();
        List<CompletableFuture<WeekOutcome>> futures = new ArrayList<>();
        for (int delta = 0; delta < weekCount; delta++) {
            WeekTarget target = anchor.target(delta);
            PageAccessor ownedSession = delta == 0 ? firstSession : null;
            targets.add(target);
            futures.add(submitWeek(ownedSession, container, target, anchor));
        }

        // Wait for all weeks to complete
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .exceptionally(e -> null)
            .join();

        List<WeekOutcome> outcomes = new ArrayList<>();
        List<CalendarEvent> merged = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            WeekOutcome outcome;
            try {
                outcome = futures.get(i).join();
            } catch (Exception e) {
                logger.error("Error getting result for week {}", targets.get(i).isoWeek(), e);
                outcome = WeekOutcome.failed(targets.get(i), ScrapeErrorKind.PAGE_ACCESS, String.valueOf(e.getMessage()));
            }
            outcomes.add(outcome);
            if (outcome.failed()) {
                logger.warn("Week {} dropped: {}", outcome.target().isoWeek(), outcome.diagnostics());
            } else {
                merged.addAll(outcome.events());
            }
        }

        logger.info("Scrape finished: {} events from {} of {} weeks",
            merged.size(), weekCount - countFailed(outcomes), weekCount);
        return new ScrapeReport(merged, outcomes);
    }

    /**
     * Schedules one week. The timeout starts when the worker starts, not while
     * the week waits for a free slot in the pool. A timed-out worker is
     * interrupted so its slot goes to the next queued week.
     */
    private CompletableFuture<WeekOutcome> submitWeek(PageAccessor ownedSession, GridContainer container,
                                                      WeekTarget target, ScrapeAnchor anchor) {
        CompletableFuture<WeekOutcome> result = new CompletableFuture<>();
        WeekOutcome timedOut = timedOut(target);
        Future<?> task;
        try {
            task = executorService.submit(() -> {
                result.completeOnTimeout(timedOut, workerTimeout.toMillis(), TimeUnit.MILLISECONDS);
                try {
                    result.complete(executeWeek(ownedSession, container, target, anchor));
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            if (ownedSession != null) {
                ownedSession.close();
            }
            result.complete(WeekOutcome.failed(target, ScrapeErrorKind.PAGE_ACCESS,
                "Week " + target.isoWeek() + " rejected: orchestrator is shut down"));
            return result;
        }

        result.thenAccept(outcome -> {
            if (outcome == timedOut) {
                logger.warn("Week {} timed out after {}, interrupting its worker", target.isoWeek(), workerTimeout);
                task.cancel(true);
            }
        });
        return result;
    }

    private GridContainer readContainer(PageAccessor firstSession) throws ScrapeException {
        try {
            return firstSession.getContainerDimensions();
        } catch (ScrapeException | RuntimeException e) {
            firstSession.close();
            throw ScrapeException.containerUnavailable("Failed to read the grid container", e);
        }
    }

    private PageAccessor openFirstSession() throws ScrapeException {
        try {
            return sessionFactory.openSession();
        } catch (ScrapeException e) {
            throw ScrapeException.containerUnavailable("Failed to open the planning page", e);
        }
    }

    private WeekOutcome executeWeek(PageAccessor ownedSession, GridContainer container,
                                    WeekTarget target, ScrapeAnchor anchor) {
        logger.info("Starting worker for week {}", target.isoWeek());
        PageAccessor session = ownedSession;
        try {
            if (session == null) {
                session = sessionFactory.openSession();
            }
            return worker.run(session, container, target, anchor.mondayStart());
        } catch (ScrapeException e) {
            logger.warn("Week {} failed with {}", target.isoWeek(), e.getKind(), e);
            return WeekOutcome.failed(target, e.getKind(), e.getMessage());
        } catch (Exception e) {
            logger.error("Week {} failed unexpectedly", target.isoWeek(), e);
            return WeekOutcome.failed(target, ScrapeErrorKind.PAGE_ACCESS, String.valueOf(e.getMessage()));
        } finally {
            if (session != null) {
                session.close();
            }
        }
    }

    private WeekOutcome timedOut(WeekTarget target) {
        return WeekOutcome.failed(target, ScrapeErrorKind.TIMEOUT,
            "Week " + target.isoWeek() + " did not finish within " + workerTimeout);
    }

    private static long countFailed(List<WeekOutcome> outcomes) {
        return outcomes.stream().filter(WeekOutcome::failed).count();
    }

    @Override
    public void close() {
        executorService.shutdownNow();
    }
}
