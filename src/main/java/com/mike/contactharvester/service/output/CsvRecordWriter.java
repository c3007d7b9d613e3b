package com.mike.contactharvester.service.output;

import com.mike.contactharvester.dto.EmailRecord;
import com.mike.contactharvester.service.crawl.EmailAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes accepted records as {@code Query,Title,Email,SourceURL} CSV, sorted by email.
 */
@Component
@Slf4j
public class CsvRecordWriter {

    public static final String HEADER = "Query,Title,Email,SourceURL";

    /**
     * Writes the merged file and, when {@code perCategory} is set, one {@code <basename>-<category>.csv}
     * next to it for every category.
     *
     * @return the files written, merged file first
     */
    public List<Path> write(EmailAggregator aggregator, Path target, boolean perCategory) throws IOException {
        List<Path> written = new ArrayList<>();
        written.add(write(aggregator.snapshot(), target));

        if (perCategory) {
            for (Map.Entry<String, List<EmailRecord>> e : aggregator.partitionBy(EmailRecord::getCategory).entrySet()) {
                written.add(write(e.getValue(), categoryFile(target, e.getKey())));
            }
        }
        return written;
    }

    public Path write(List<EmailRecord> records, Path target) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }

        List<String> lines = new ArrayList<>(records.size() + 1);
        lines.add(HEADER);
        records.stream()
                .sorted(Comparator.comparing(EmailRecord::getAddress))
                .forEach(r -> lines.add(csv(r.getOriginQuery()) + "," + csv(r.getPageTitle()) + ","
                        + csv(r.getAddress()) + "," + csv(r.getSourceUrl())));

        Files.write(target, lines, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);

        log.info("CsvRecordWriter: wrote {} rows to {}", records.size(), target);
        return target;
    }

    static Path categoryFile(Path target, String category) {
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return target.resolveSibling(base + "-" + slug(category) + ".csv");
    }

    static String slug(String category) {
        String s = category == null ? "" : category.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
        return s.isEmpty() ? "default" : s;
    }

    // RFC 4180: quote only when the field needs it
    static String csv(String v) {
        String s = v == null ? "" : v;
        if (s.indexOf(',') < 0 && s.indexOf('"') < 0 && s.indexOf('\n') < 0 && s.indexOf('\r') < 0) {
            return s;
        }
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }
}
