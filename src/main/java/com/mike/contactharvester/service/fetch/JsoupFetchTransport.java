package com.mike.contactharvester.service.fetch;

import com.mike.contactharvester.config.HarvesterProperties;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

@Component
@ConditionalOnProperty(prefix = "harvester.fetch", name = "transport", havingValue = "HTTP", matchIfMissing = true)
@Slf4j
public class JsoupFetchTransport implements FetchTransport {

    private static final int MAX_BODY_BYTES = 5 * 1024 * 1024;

    private final List<String> userAgents;
    private final String referrer;

    public JsoupFetchTransport(HarvesterProperties properties) {
        this.userAgents = properties.getFetch().getUserAgents();
        this.referrer = properties.getFetch().getReferrer();
    }

    @Override
    public TransportResponse get(String url, Duration timeout) throws IOException {
        Connection.Response response = Jsoup.connect(url)
                .userAgent(randomUserAgent())
                .referrer(referrer)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .timeout((int) timeout.toMillis())
                .maxBodySize(MAX_BODY_BYTES)
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .execute();

        log.trace("JsoupFetchTransport: {} -> status={}, contentType={}",
                url, response.statusCode(), response.contentType());

        return new TransportResponse(response.statusCode(), response.body(), response.contentType());
    }

    private String randomUserAgent() {
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }
}
