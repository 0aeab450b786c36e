package com.planningsync.infrastructure.scraper;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Utility for fetching rendered planning pages.
 */
public class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;
    private static final Timeout REQUEST_TIMEOUT = Timeout.ofSeconds(30);

    private HttpClientUtil() {
    }

    /**
     * Helper method to log response body preview for debugging.
     */
    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.error("Response body preview: {}", preview);
    }

    /**
     * Makes a GET request and returns the response body as HTML text.
     */
    public static String getHtml(String url, Map<String, String> headers) throws IOException {
        RequestConfig config = RequestConfig.custom()
            .setConnectionRequestTimeout(REQUEST_TIMEOUT)
            .setResponseTimeout(REQUEST_TIMEOUT)
            .build();

        try (CloseableHttpClient httpClient = HttpClients.custom().setDefaultRequestConfig(config).build()) {
            HttpGet request = new HttpGet(url);
            request.addHeader("accept", "text/html,application/xhtml+xml");

            // Add headers
            if (headers != null) {
                headers.forEach(request::addHeader);
            }

            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getCode();
                String responseBody;
                String contentType = null;

                // Get content type from entity before consuming it
                HttpEntity entity = response.getEntity();
                if (entity != null && entity.getContentType() != null) {
                    contentType = entity.getContentType();
                }

                try {
                    responseBody = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
                } catch (org.apache.hc.core5.http.ParseException e) {
                    throw new IOException("Failed to parse response", e);
                }

                if (statusCode < 200 || statusCode >= 300) {
                    logger.error("HTTP request failed with status {}. URL: {}", statusCode, url);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("HTTP request failed with status " + statusCode);
                }

                // If content-type is missing we still try to parse the body as HTML
                if (contentType != null && !contentType.isEmpty()
                    && !contentType.toLowerCase().contains("html")) {
                    logger.error("Expected HTML but received content-type: {}. URL: {}", contentType, url);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("Expected HTML response but received: " + contentType);
                }

                return responseBody;
            }
        }
    }
}
