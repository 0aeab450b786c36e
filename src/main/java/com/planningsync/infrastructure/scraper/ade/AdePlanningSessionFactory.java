package com.planningsync.infrastructure.scraper.ade;

import com.planningsync.domain.model.GridLayout;
import com.planningsync.domain.model.ScrapeException;
import com.planningsync.domain.ports.PageAccessor;
import com.planningsync.domain.ports.PageSessionFactory;
import com.planningsync.infrastructure.config.TimetableProperties;
import com.planningsync.infrastructure.scraper.HttpClientUtil;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Opens ADE planning page sessions over HTTP.
 */
@Component
public class AdePlanningSessionFactory implements PageSessionFactory {

    private final String url;
    private final Map<String, String> headers;
    private final GridLayout layout;

    public AdePlanningSessionFactory(TimetableProperties properties, GridLayout layout) {
        this.url = properties.getUrl();
        this.headers = new LinkedHashMap<>();
        properties.getHeaders().forEach((name, value) -> {
            if (value != null && !value.isBlank()) {
                headers.put(name, value);
            }
        });
        this.layout = layout;
    }

    @Override
    public PageAccessor openSession() throws ScrapeException {
        if (url == null || url.isBlank()) {
            throw ScrapeException.pageAccess("timetable.url is not configured", null);
        }
        return new AdePlanningPage(pageUrl -> HttpClientUtil.getHtml(pageUrl, headers), layout, url);
    }
}
