package com.mike.contactharvester.service.crawl;

import com.mike.contactharvester.dto.CrawlTask;
import com.mike.contactharvester.util.UrlUtils;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * State of one seed URL's bounded exploration: the frontier, the visited set and the per-host page budget.
 * Owned by a single worker and discarded when the session ends.
 */
public class CrawlSession {

    private final String seedUrl;
    private final int maxPagesPerHost;
    private final int maxPagesTotal;

    private final Deque<CrawlTask> frontier = new ArrayDeque<>();
    private final Set<String> visited = new HashSet<>();
    private final Map<String, Integer> hostBudget = new HashMap<>();
    private int pagesAdmitted;

    public CrawlSession(String seedUrl, int maxPagesPerHost, int maxPagesTotal) {
        if (maxPagesPerHost < 1 || maxPagesTotal < 1) {
            throw new IllegalArgumentException("Page budgets must be positive: perHost=" + maxPagesPerHost
                    + ", total=" + maxPagesTotal);
        }
        this.seedUrl = seedUrl;
        this.maxPagesPerHost = maxPagesPerHost;
        this.maxPagesTotal = maxPagesTotal;
    }

    public String seedUrl() {
        return seedUrl;
    }

    public void enqueue(CrawlTask task) {
        frontier.addLast(task);
    }

    public CrawlTask poll() {
        return frontier.pollFirst();
    }

    /**
     * Atomic check-and-set: false when the URL was already admitted in this session, when it has no host,
     * or when its host (or the session) has used up its page budget. Otherwise records the visit,
     * charges the host and returns true.
     */
    public synchronized boolean shouldVisit(String url) {
        String normalized = UrlUtils.normalize(url);
        String host = UrlUtils.hostOf(url);
        if (normalized == null || host == null) return false;

        if (visited.contains(normalized)) return false;
        if (pagesAdmitted >= maxPagesTotal) return false;

        int used = hostBudget.getOrDefault(host, 0);
        if (used >= maxPagesPerHost) return false;

        visited.add(normalized);
        hostBudget.put(host, used + 1);
        pagesAdmitted++;
        return true;
    }

    public synchronized int pagesAdmitted() {
        return pagesAdmitted;
    }

    public synchronized int pagesAdmitted(String host) {
        return hostBudget.getOrDefault(host, 0);
    }
}
