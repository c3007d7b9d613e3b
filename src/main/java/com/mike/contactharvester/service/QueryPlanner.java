package com.mike.contactharvester.service;

import com.mike.contactharvester.config.HarvesterProperties;
import com.mike.contactharvester.dto.HarvestQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the run's query list: explicit queries under "default", then one category per country
 * expanded from keywords x templates. Each category is capped at maxQueriesPerBatch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryPlanner {

    static final String FALLBACK_TLD = "com";

    private final HarvesterProperties properties;

    public List<HarvestQuery> plan() {
        List<HarvestQuery> planned = new ArrayList<>();
        int cap = properties.getMaxQueriesPerBatch();

        for (String q : capped(properties.getQueries(), cap)) {
            planned.add(HarvestQuery.of(q));
        }

        for (String country : properties.getCountries()) {
            if (country == null || country.isBlank()) continue;
            String c = country.trim();
            String tld = tldFor(c);

            List<String> expanded = new ArrayList<>();
            for (String keyword : properties.getKeywords()) {
                for (String template : properties.getQueryTemplates()) {
                    expanded.add(template
                            .replace("{keyword}", keyword)
                            .replace("{country}", c)
                            .replace("{tld}", tld));
                }
            }

            List<String> kept = capped(expanded, cap);
            log.info("QueryPlanner: country={} tld={} -> {} queries (of {} combinations)",
                    c, tld, kept.size(), expanded.size());
            kept.forEach(q -> planned.add(new HarvestQuery(q, c)));
        }

        log.info("QueryPlanner: planned {} queries in total", planned.size());
        return planned;
    }

    String tldFor(String country) {
        Map<String, String> tlds = properties.getCountryTlds();
        for (Map.Entry<String, String> e : tlds.entrySet()) {
            if (e.getKey().equalsIgnoreCase(country)) {
                return e.getValue().toLowerCase(Locale.ROOT);
            }
        }
        return FALLBACK_TLD;
    }

    private static List<String> capped(List<String> queries, int cap) {
        Set<String> unique = new LinkedHashSet<>();
        if (cap <= 0) return List.of();
        for (String q : queries) {
            if (q == null || q.isBlank()) continue;
            unique.add(q.trim());
            if (unique.size() >= cap) break;
        }
        return new ArrayList<>(unique);
    }
}
