package com.mike.contactharvester.service.crawl;

import com.mike.contactharvester.dto.EmailRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Run-wide, thread-safe record set keyed by lowercase address. The first record committed for an
 * address wins; later ones are dropped.
 */
public class EmailAggregator {

    private final ConcurrentHashMap<String, EmailRecord> records = new ConcurrentHashMap<>();

    /**
     * @return true when the address was not stored yet
     */
    public boolean add(EmailRecord record) {
        return records.putIfAbsent(record.getAddress(), record) == null;
    }

    /**
     * @return how many of the given records were new
     */
    public int addAll(Collection<EmailRecord> batch) {
        int added = 0;
        for (EmailRecord record : batch) {
            if (add(record)) added++;
        }
        return added;
    }

    public boolean contains(String address) {
        return records.containsKey(address);
    }

    public int size() {
        return records.size();
    }

    /**
     * All records sorted by address.
     */
    public List<EmailRecord> snapshot() {
        return records.values().stream()
                .sorted(Comparator.comparing(EmailRecord::getAddress))
                .toList();
    }

    /**
     * Records grouped by the given key (e.g. category), keys sorted, records sorted by address.
     */
    public Map<String, List<EmailRecord>> partitionBy(Function<EmailRecord, String> key) {
        Map<String, List<EmailRecord>> grouped = new TreeMap<>();
        for (EmailRecord record : snapshot()) {
            grouped.computeIfAbsent(key.apply(record), k -> new ArrayList<>()).add(record);
        }
        Map<String, List<EmailRecord>> result = new LinkedHashMap<>();
        grouped.forEach((k, v) -> result.put(k, List.copyOf(v)));
        return result;
    }
}
