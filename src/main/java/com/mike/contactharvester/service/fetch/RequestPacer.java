package com.mike.contactharvester.service.fetch;

import com.mike.contactharvester.config.HarvesterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Randomized politeness delays. A zero range disables pausing. An interrupt ends the pause
 * early and leaves the interrupt flag set for the caller to notice.
 */
@Component
@Slf4j
public class RequestPacer {

    private final HarvesterProperties.Delay delay;

    public RequestPacer(HarvesterProperties properties) {
        this.delay = properties.getDelay();
    }

    public void afterRequest() {
        pauseBetween(delay.getRequestMin(), delay.getRequestMax());
    }

    public void betweenQueries() {
        pauseBetween(delay.getQueryMin(), delay.getQueryMax());
    }

    public void pauseBetween(Duration min, Duration max) {
        long minMs = min == null ? 0 : min.toMillis();
        long maxMs = max == null ? minMs : Math.max(minMs, max.toMillis());
        long ms = maxMs > minMs ? ThreadLocalRandom.current().nextLong(minMs, maxMs + 1) : minMs;
        sleep(Duration.ofMillis(ms));
    }

    public void sleep(Duration duration) {
        long ms = duration == null ? 0 : duration.toMillis();
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            log.debug("RequestPacer: pause of {}ms interrupted", ms);
            Thread.currentThread().interrupt();
        }
    }
}
