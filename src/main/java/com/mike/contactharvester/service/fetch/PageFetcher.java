package com.mike.contactharvester.service.fetch;

import com.mike.contactharvester.config.HarvesterProperties;
import com.mike.contactharvester.dto.FetchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Fetches one page through the configured {@link FetchTransport} with bounded retries.
 * <p>
 * HTTP 429, 5xx and network errors are retried with exponential backoff
 * (base * 2^attempt, capped at backoff-max) until max-attempts is reached. Other 4xx,
 * non-HTML content and empty bodies fail immediately. Never throws: every outcome
 * is a {@link FetchResult}.
 */
@Component
@Slf4j
public class PageFetcher {

    private final FetchTransport transport;
    private final RequestPacer pacer;
    private final HarvesterProperties.Fetch settings;

    public PageFetcher(FetchTransport transport, RequestPacer pacer, HarvesterProperties properties) {
        this.transport = transport;
        this.pacer = pacer;
        this.settings = properties.getFetch();
    }

    public FetchResult fetch(String url) {
        return fetch(url, settings.getTimeout());
    }

    public FetchResult fetch(String url, Duration timeout) {
        int maxAttempts = Math.max(1, settings.getMaxAttempts());
        int lastStatus = 0;
        String lastContentType = "";

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                log.debug("PageFetcher: interrupted before attempt {} for {}", attempt + 1, url);
                return FetchResult.failed(url, lastStatus, lastContentType, attempt);
            }

            boolean retryable;
            try {
                TransportResponse response = transport.get(url, timeout);
                lastStatus = response.statusCode();
                lastContentType = response.contentType() == null ? "" : response.contentType();

                if (response.ok()) {
                    return toResult(url, response, attempt + 1);
                }

                retryable = isRetryableStatus(response.statusCode());
                if (!retryable) {
                    log.debug("PageFetcher: {} returned status={}, not retrying", url, response.statusCode());
                    return FetchResult.failed(url, lastStatus, lastContentType, attempt + 1);
                }
                log.debug("PageFetcher: {} returned status={} (attempt {}/{})",
                        url, response.statusCode(), attempt + 1, maxAttempts);

            } catch (IOException e) {
                log.debug("PageFetcher: network error for {} (attempt {}/{}): {}",
                        url, attempt + 1, maxAttempts, e.toString());
            } catch (RuntimeException e) {
                log.warn("PageFetcher: unexpected failure for {}: {}", url, e.toString());
                return FetchResult.failed(url, lastStatus, lastContentType, attempt + 1);
            }

            if (attempt + 1 < maxAttempts) {
                pacer.sleep(backoffDelay(attempt));
            }
        }

        log.warn("PageFetcher: giving up on {} after {} attempts (lastStatus={})", url, maxAttempts, lastStatus);
        return FetchResult.failed(url, lastStatus, lastContentType, maxAttempts);
    }

    Duration backoffDelay(int attempt) {
        long base = settings.getBackoffBase().toMillis();
        long cap = settings.getBackoffMax().toMillis();
        long delay = base << Math.min(attempt, 30);
        if (delay < 0 || delay > cap) delay = cap;
        return Duration.ofMillis(delay);
    }

    static boolean isRetryableStatus(int status) {
        return status == 429 || (status >= 500 && status < 600);
    }

    static boolean isHtml(String contentType) {
        if (contentType == null || contentType.isBlank()) return false;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml+xml");
    }

    private FetchResult toResult(String url, TransportResponse response, int attempts) {
        if (!isHtml(response.contentType())) {
            log.debug("PageFetcher: {} is not HTML (contentType={}), skipping", url, response.contentType());
            return FetchResult.failed(url, response.statusCode(), response.contentType(), attempts);
        }
        if (response.body() == null || response.body().isBlank()) {
            log.debug("PageFetcher: {} returned an empty body", url);
            return FetchResult.failed(url, response.statusCode(), response.contentType(), attempts);
        }
        return FetchResult.ok(url, response.statusCode(), response.body(), response.contentType(), attempts);
    }
}
