package com.planningsync.infrastructure.config;

import com.planningsync.domain.model.GridLayout;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for scraping and publishing the timetable.
 */
@ConfigurationProperties(prefix = "timetable")
public class TimetableProperties {

    /** Planning page, already rendered and authenticated. */
    private String url;

    /** Extra request headers sent with every page request (e.g. a session cookie). */
    private Map<String, String> headers = new LinkedHashMap<>();

    /** Number of consecutive weeks scraped per sync, starting with the current one. */
    private int weekCount = 5;

    /** Maximum number of weeks scraped at the same time. */
    private int maxConcurrency = 4;

    private Duration workerTimeout = Duration.ofMinutes(2);

    private int dayCount = GridLayout.DEFAULT.dayCount();

    private int startHour = GridLayout.DEFAULT.startHour();

    private int endHour = GridLayout.DEFAULT.endHour();

    /** Offset added to every decoded start time. */
    private Duration timezoneCorrection = Duration.ofHours(-1);

    private boolean icsEnabled = true;

    private String icsOutputPath = "planning.ics";

    public GridLayout toGridLayout() {
        return new GridLayout(dayCount, startHour, endHour);
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public void setHeaders(Map<String, String> headers) {
        this.headers = headers;
    }

    public int getWeekCount() {
        return weekCount;
    }

    public void setWeekCount(int weekCount) {
        this.weekCount = weekCount;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getWorkerTimeout() {
        return workerTimeout;
    }

    public void setWorkerTimeout(Duration workerTimeout) {
        this.workerTimeout = workerTimeout;
    }

    public int getDayCount() {
        return dayCount;
    }

    public void setDayCount(int dayCount) {
        this.dayCount = dayCount;
    }

    public int getStartHour() {
        return startHour;
    }

    public void setStartHour(int startHour) {
        this.startHour = startHour;
    }

    public int getEndHour() {
        return endHour;
    }

    public void setEndHour(int endHour) {
        this.endHour = endHour;
    }

    public Duration getTimezoneCorrection() {
        return timezoneCorrection;
    }

    public void setTimezoneCorrection(Duration timezoneCorrection) {
        this.timezoneCorrection = timezoneCorrection;
    }

    public boolean isIcsEnabled() {
        return icsEnabled;
    }

    public void setIcsEnabled(boolean icsEnabled) {
        this.icsEnabled = icsEnabled;
    }

    public String getIcsOutputPath() {
        return icsOutputPath;
    }

    public void setIcsOutputPath(String icsOutputPath) {
        this.icsOutputPath = icsOutputPath;
    }
}
