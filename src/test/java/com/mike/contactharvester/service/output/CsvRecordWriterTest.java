package com.mike.contactharvester.service.output;

import com.mike.contactharvester.dto.EmailRecord;
import com.mike.contactharvester.service.crawl.EmailAggregator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvRecordWriterTest {

    @TempDir
    Path tempDir;

    private final CsvRecordWriter writer = new CsvRecordWriter();

    private static EmailRecord record(String address, String title, String category) {
        return EmailRecord.builder()
                .address(address)
                .sourceUrl("https://" + address.substring(address.indexOf('@') + 1) + "/contact")
                .originQuery("air charter")
                .pageTitle(title)
                .category(category)
                .build();
    }

    @Test
    @DisplayName("exact header, rows sorted by email, fields quoted only when needed")
    void writesMergedFile() throws IOException {
        EmailAggregator aggregator = new EmailAggregator();
        aggregator.add(record("zed@skyjet.aero", "SkyJet, \"Charter\" desk", "default"));
        aggregator.add(record("amy@jet.ae", "Jet", "default"));
        Path target = tempDir.resolve("out/harvest.csv");

        List<Path> written = writer.write(aggregator, target, false);

        assertEquals(List.of(target), written);
        assertEquals(List.of(
                "Query,Title,Email,SourceURL",
                "air charter,Jet,amy@jet.ae,https://jet.ae/contact",
                "air charter,\"SkyJet, \"\"Charter\"\" desk\",zed@skyjet.aero,https://skyjet.aero/contact"),
                Files.readAllLines(target, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("per-category files next to the merged one")
    void writesPerCategoryFiles() throws IOException {
        EmailAggregator aggregator = new EmailAggregator();
        aggregator.add(record("ops@jet.co.ke", "Jet", "Kenya"));
        aggregator.add(record("info@sky.za", "Sky", "South Africa"));
        aggregator.add(record("amy@jet.ae", "Jet", "default"));
        Path target = tempDir.resolve("harvest.csv");

        List<Path> written = writer.write(aggregator, target, true);

        assertEquals(List.of(target,
                tempDir.resolve("harvest-kenya.csv"),
                tempDir.resolve("harvest-south-africa.csv"),
                tempDir.resolve("harvest-default.csv")), written);
        assertEquals(List.of("Query,Title,Email,SourceURL", "air charter,Sky,info@sky.za,https://sky.za/contact"),
                Files.readAllLines(tempDir.resolve("harvest-south-africa.csv")));
        assertEquals(4, Files.readAllLines(target).size());
    }

    @Test
    void emptyAggregatorWritesHeaderOnly() throws IOException {
        Path target = tempDir.resolve("empty.csv");

        writer.write(new EmailAggregator(), target, false);

        assertEquals(List.of(CsvRecordWriter.HEADER), Files.readAllLines(target));
    }

    @Test
    void slugAndQuoting() {
        assertEquals("c-te-d-ivoire", CsvRecordWriter.slug("Côte d'Ivoire"));
        assertEquals("default", CsvRecordWriter.slug("  "));
        assertEquals("\"line\nbreak\"", CsvRecordWriter.csv("line\nbreak"));
        assertTrue(CsvRecordWriter.csv(null).isEmpty());
    }
}
