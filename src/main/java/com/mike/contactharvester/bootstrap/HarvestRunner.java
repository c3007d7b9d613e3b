package com.mike.contactharvester.bootstrap;

import com.mike.contactharvester.config.HarvesterProperties;
import com.mike.contactharvester.dto.HarvestQuery;
import com.mike.contactharvester.dto.HarvestRunSummary;
import com.mike.contactharvester.service.HarvestOrchestrator;
import com.mike.contactharvester.service.HarvestResult;
import com.mike.contactharvester.service.QueryPlanner;
import com.mike.contactharvester.service.output.CsvRecordWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * One-shot batch run on startup: plan queries, harvest, write the CSV files.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "harvester.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class HarvestRunner implements CommandLineRunner {

    private final QueryPlanner queryPlanner;
    private final HarvestOrchestrator orchestrator;
    private final CsvRecordWriter csvWriter;
    private final HarvesterProperties properties;

    @Override
    public void run(String... args) {
        List<HarvestQuery> queries = queryPlanner.plan();
        orchestrator.validate(queries);

        HarvestResult result = orchestrator.run(queries);
        HarvestRunSummary summary = result.summary();

        Path target = Path.of(properties.getOutput().getPath());
        try {
            List<Path> files = csvWriter.write(result.aggregator(), target, properties.getOutput().isPerCategory());
            log.info("HarvestRunner: wrote {} file(s), merged output={}", files.size(), files.get(0));
        } catch (IOException e) {
            log.error("HarvestRunner: could not write results to {}", target, e);
            throw new UncheckedIOException(e);
        }

        if (summary.isCancelled()) {
            log.warn("HarvestRunner: run was cancelled, results are partial -> {}", summary.toLogLine());
        } else {
            log.info("HarvestRunner: done -> {}", summary.toLogLine());
        }
    }
}
