package com.mike.contactharvester.service.crawl;

import com.mike.contactharvester.config.HarvesterProperties;
import com.mike.contactharvester.dto.CrawlTask;
import com.mike.contactharvester.dto.EmailRecord;
import com.mike.contactharvester.dto.FetchResult;
import com.mike.contactharvester.service.emailextractor.DomainMxVerifier;
import com.mike.contactharvester.service.emailextractor.SignalExtractor;
import com.mike.contactharvester.service.fetch.PageFetcher;
import com.mike.contactharvester.service.fetch.RequestPacer;
import com.mike.contactharvester.service.filter.FilterContext;
import com.mike.contactharvester.service.filter.RelevanceFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one session end-to-end on the calling thread: fetch the seed, discover contact-like links on it,
 * fetch those, and extract + filter addresses on every fetched page. Discovery happens on the seed only,
 * so a session never goes deeper than one hop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionCrawler {

    private final PageFetcher pageFetcher;
    private final LinkDiscoverer linkDiscoverer;
    private final SignalExtractor signalExtractor;
    private final RelevanceFilter relevanceFilter;
    private final DomainMxVerifier mxVerifier;
    private final RequestPacer pacer;
    private final HarvesterProperties properties;

    public SessionResult crawl(CrawlTask seed, String category) {
        CrawlSession session = new CrawlSession(seed.url(),
                properties.getMaxPagesPerHost(), properties.getMaxPagesPerSession());
        session.enqueue(seed);

        Map<String, EmailRecord> accepted = new LinkedHashMap<>();
        int pagesFetched = 0;
        int candidatesFound = 0;

        CrawlTask task;
        while ((task = session.poll()) != null) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("SessionCrawler: session for {} interrupted after {} pages, discarding", seed.url(), pagesFetched);
                return SessionResult.aborted(seed.url(), pagesFetched);
            }
            if (!session.shouldVisit(task.url())) {
                log.debug("SessionCrawler: skipping {} (visited or over budget)", task.url());
                continue;
            }

            FetchResult page = pageFetcher.fetch(task.url());
            pacer.afterRequest();
            if (!page.statusOk()) {
                log.debug("SessionCrawler: no content from {} (status={})", task.url(), page.statusCode());
                continue;
            }
            pagesFetched++;

            String title = titleOf(page.body());
            FilterContext context = new FilterContext(page.url(), task.originQuery());

            for (String candidate : signalExtractor.extract(page.body())) {
                candidatesFound++;
                if (accepted.containsKey(candidate)) continue;
                if (!relevanceFilter.accept(candidate, context)) continue;
                if (!mxVerifier.isDomainAllowed(candidate)) continue;

                accepted.put(candidate, EmailRecord.builder()
                        .address(candidate)
                        .sourceUrl(page.url())
                        .originQuery(task.originQuery())
                        .pageTitle(title)
                        .category(category)
                        .build());
                log.debug("SessionCrawler: accepted {} on {}", candidate, page.url());
            }

            if (task.isSeed()) {
                List<String> related = linkDiscoverer.discover(page.url(), page.body(), properties.getDiscoverLimit());
                log.debug("SessionCrawler: {} contact-like links on seed {}", related.size(), page.url());
                related.forEach(url -> session.enqueue(seed.discovered(url)));
            }
        }

        if (Thread.currentThread().isInterrupted()) {
            log.info("SessionCrawler: session for {} interrupted on its last page, discarding", seed.url());
            return SessionResult.aborted(seed.url(), pagesFetched);
        }

        log.info("SessionCrawler: finished {} -> pages={}, candidates={}, accepted={}",
                seed.url(), pagesFetched, candidatesFound, accepted.size());
        return new SessionResult(seed.url(), List.copyOf(accepted.values()), pagesFetched, candidatesFound, true);
    }

    private String titleOf(String html) {
        try {
            return Jsoup.parse(html).title();
        } catch (RuntimeException e) {
            log.debug("SessionCrawler: could not read page title: {}", e.toString());
            return "";
        }
    }
}
