package com.mike.contactharvester.service;

import com.mike.contactharvester.config.HarvesterProperties;
import com.mike.contactharvester.dto.CrawlTask;
import com.mike.contactharvester.dto.HarvestQuery;
import com.mike.contactharvester.dto.HarvestRunSummary;
import com.mike.contactharvester.dto.SearchEngine;
import com.mike.contactharvester.service.crawl.EmailAggregator;
import com.mike.contactharvester.service.crawl.SessionCrawler;
import com.mike.contactharvester.service.crawl.SessionResult;
import com.mike.contactharvester.service.fetch.RequestPacer;
import com.mike.contactharvester.service.filter.SeedUrlFilter;
import com.mike.contactharvester.service.search.SearchProvider;
import com.mike.contactharvester.service.search.SearchProviderException;
import com.mike.contactharvester.util.UrlUtils;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a whole run: for every query, collects seed URLs from all engines, crawls one session per seed
 * on a bounded worker pool and commits the finished sessions into a run-wide {@link EmailAggregator}.
 * <p>
 * Queries are processed one after another; all sessions of a query are joined before the next query
 * starts. {@link #cancel()} stops the run between queries and interrupts running sessions, whose partial
 * results are dropped. Sessions that had already finished stay committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HarvestOrchestrator {

    private final SearchProvider searchProvider;
    private final SeedUrlFilter seedUrlFilter;
    private final SessionCrawler sessionCrawler;
    private final RequestPacer pacer;
    private final HarvesterProperties properties;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile ExecutorService activePool;
    private volatile List<Future<SessionResult>> activeSessions = List.of();

    /**
     * @throws IllegalStateException when the run cannot start (no queries, no engines, non-positive limits)
     */
    public void validate(List<HarvestQuery> queries) {
        if (queries == null || queries.isEmpty()) {
            throw new IllegalStateException("No queries to run: configure harvester.queries or harvester.countries");
        }
        if (properties.getEngines() == null || properties.getEngines().isEmpty()) {
            throw new IllegalStateException("No search engines configured (harvester.engines)");
        }
        requirePositive("harvester.worker-pool-size", properties.getWorkerPoolSize());
        requirePositive("harvester.url-limit-per-query", properties.getUrlLimitPerQuery());
        requirePositive("harvester.max-pages-per-session", properties.getMaxPagesPerSession());
        requirePositive("harvester.max-pages-per-host", properties.getMaxPagesPerHost());
        requirePositive("harvester.max-queries-per-batch", properties.getMaxQueriesPerBatch());
        if (properties.getDiscoverLimit() < 0) {
            throw new IllegalStateException("harvester.discover-limit must not be negative");
        }
    }

    public HarvestResult run(List<HarvestQuery> queries) {
        validate(queries);
        cancelled.set(false);

        EmailAggregator aggregator = new EmailAggregator();
        int queriesRun = 0;
        int providerErrors = 0;
        int seedUrls = 0;
        int sessionsCompleted = 0;
        int sessionsFailed = 0;
        int pagesFetched = 0;
        int candidatesFound = 0;
        int emailsAccepted = 0;

        AtomicInteger workerNo = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(properties.getWorkerPoolSize(), r -> {
            Thread t = new Thread(r, "harvest-worker-" + workerNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        activePool = pool;

        log.info("HarvestOrchestrator: starting run with {} queries, engines={}, workers={}",
                queries.size(), properties.getEngines(), properties.getWorkerPoolSize());

        try {
            for (int i = 0; i < queries.size(); i++) {
                if (isStopped()) {
                    cancelled.set(true);
                    log.warn("HarvestOrchestrator: run cancelled before query {}/{}", i + 1, queries.size());
                    break;
                }
                HarvestQuery query = queries.get(i);
                log.info("HarvestOrchestrator: [{}/{}] query='{}' category={}",
                        i + 1, queries.size(), query.text(), query.category());

                SeedBatch batch = collectSeeds(query);
                providerErrors += batch.providerErrors();
                seedUrls += batch.urls().size();
                if (isStopped()) {
                    cancelled.set(true);
                    log.warn("HarvestOrchestrator: run cancelled while searching query {}/{}", i + 1, queries.size());
                    break;
                }

                List<Future<SessionResult>> futures = new ArrayList<>();
                for (String url : batch.urls()) {
                    CrawlTask seed = CrawlTask.seed(url, query.text());
                    try {
                        futures.add(pool.submit(() -> sessionCrawler.crawl(seed, query.category())));
                    } catch (RejectedExecutionException e) {
                        // pool was shut down by cancel()
                        cancelled.set(true);
                        sessionsFailed += batch.urls().size() - futures.size();
                        break;
                    }
                }
                activeSessions = futures;
                if (cancelled.get()) {
                    futures.forEach(f -> f.cancel(true));
                }

                for (Future<SessionResult> future : futures) {
                    SessionResult result;
                    try {
                        result = future.get();
                    } catch (CancellationException e) {
                        sessionsFailed++;
                        continue;
                    } catch (ExecutionException e) {
                        log.warn("HarvestOrchestrator: session failed for query='{}': {}",
                                query.text(), String.valueOf(e.getCause()));
                        sessionsFailed++;
                        continue;
                    } catch (InterruptedException e) {
                        log.warn("HarvestOrchestrator: interrupted while waiting for sessions, cancelling run");
                        Thread.currentThread().interrupt();
                        cancel();
                        sessionsFailed++;
                        continue;
                    }

                    pagesFetched += result.pagesFetched();
                    if (!result.completed()) {
                        sessionsFailed++;
                        continue;
                    }
                    sessionsCompleted++;
                    candidatesFound += result.candidatesFound();
                    emailsAccepted += result.records().size();
                    int added = aggregator.addAll(result.records());
                    log.debug("HarvestOrchestrator: session {} committed {} new of {} accepted",
                            result.seedUrl(), added, result.records().size());
                }
                activeSessions = List.of();
                queriesRun++;

                log.info("HarvestOrchestrator: query '{}' done, unique emails so far={}", query.text(), aggregator.size());

                if (i < queries.size() - 1 && !isStopped()) {
                    pacer.betweenQueries();
                }
            }
        } finally {
            pool.shutdownNow();
            activePool = null;
            activeSessions = List.of();
        }

        HarvestRunSummary summary = HarvestRunSummary.builder()
                .cancelled(cancelled.get())
                .queriesRun(queriesRun)
                .providerErrors(providerErrors)
                .seedUrls(seedUrls)
                .sessionsCompleted(sessionsCompleted)
                .sessionsFailed(sessionsFailed)
                .pagesFetched(pagesFetched)
                .candidatesFound(candidatesFound)
                .emailsAccepted(emailsAccepted)
                .emailsUnique(aggregator.size())
                .build();

        log.info("HarvestOrchestrator: run finished -> {}", summary.toLogLine());
        return new HarvestResult(aggregator, summary);
    }

    /**
     * Stops the current run: no further query or session starts and running sessions are interrupted.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("HarvestOrchestrator: cancel requested");
        }
        activeSessions.forEach(f -> f.cancel(true));
        ExecutorService pool = activePool;
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @PreDestroy
    void onShutdown() {
        if (activePool != null) {
            cancel();
        }
    }

    SeedBatch collectSeeds(HarvestQuery query) {
        int limit = properties.getUrlLimitPerQuery();
        int errors = 0;

        // normalized url -> first seen url
        Map<String, String> merged = new LinkedHashMap<>();
        for (SearchEngine engine : properties.getEngines().stream().sorted().toList()) {
            if (isStopped()) break;
            try {
                List<String> found = searchProvider.search(query.text(), engine, limit);
                for (String url : found) {
                    String key = UrlUtils.normalize(url);
                    if (key != null) {
                        merged.putIfAbsent(key, url);
                    }
                }
            } catch (SearchProviderException e) {
                errors++;
                log.warn("HarvestOrchestrator: provider {} failed for query='{}': {}",
                        engine, query.text(), e.getMessage());
            } catch (RuntimeException e) {
                errors++;
                log.error("HarvestOrchestrator: unexpected error from provider {} for query='{}'",
                        engine, query.text(), e);
            }
        }

        List<String> seeds = merged.values().stream()
                .filter(seedUrlFilter::isAllowed)
                .limit(limit)
                .toList();

        log.info("HarvestOrchestrator: query='{}' -> {} merged URLs, {} seeds after pre-filter, providerErrors={}",
                query.text(), merged.size(), seeds.size(), errors);
        return new SeedBatch(seeds, errors);
    }

    private boolean isStopped() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalStateException(name + " must be positive, was " + value);
        }
    }

    record SeedBatch(List<String> urls, int providerErrors) {
    }
}
