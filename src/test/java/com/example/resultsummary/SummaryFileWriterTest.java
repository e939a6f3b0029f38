package com.example.resultsummary;

import com.example.resultsummary.summary.DirectorySummary;
import com.example.resultsummary.summary.SummaryCodec;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.stream.Stream;

import static com.example.resultsummary.SummaryBuilderTest.createFile;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SummaryFileWriterTest {
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1500000000L), ZoneOffset.UTC);

    private final SummaryCodec codec = new SummaryCodec();

    @Test
    void writesSummaryNamedAfterCurrentTime() throws Exception {
        Path dir = Files.createTempDirectory("writer-test");
        createFile(dir.resolve("a"), 12);
        SummaryFileWriter writer = writer(SummaryConfig.defaults());

        Path written = writer.write(dir);

        assertEquals(dir.resolve("dir_summary_1500000000.json"), written);
        DirectorySummary summary = codec.read(written);
        assertEquals(12L, summary.originalBytes());
        assertEquals(12L, summary.find("a").originalSize());
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(2L, files.count());
        }
    }

    @Test
    void appendsCounterWhenNameIsTaken() throws Exception {
        Path dir = Files.createTempDirectory("writer-unique");
        SummaryFileWriter writer = writer(SummaryConfig.defaults());

        Path first = writer.write(dir);
        Path second = writer.write(dir);
        Path third = writer.write(dir);

        assertEquals("dir_summary_1500000000.json", first.getFileName().toString());
        assertEquals("dir_summary_1500000000_1.json", second.getFileName().toString());
        assertEquals("dir_summary_1500000000_2.json", third.getFileName().toString());
        // The second summary includes the first one.
        assertEquals(Files.size(first), codec.read(second).originalBytes());
    }

    @Test
    void neverReplacesAnExistingSummaryFile() throws Exception {
        Path dir = Files.createTempDirectory("writer-existing");
        Path existing = dir.resolve("dir_summary_1500000000.json");
        Files.writeString(existing, "{\"\": {\"/S\": 7}}");
        SummaryFileWriter writer = writer(SummaryConfig.defaults());

        Path written = writer.write(dir);

        assertEquals(dir.resolve("dir_summary_1500000000_1.json"), written);
        assertEquals("{\"\": {\"/S\": 7}}", Files.readString(existing));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(2L, files.count());
        }
    }

    @Test
    void refusesToFillTheDisk() throws Exception {
        Path dir = Files.createTempDirectory("writer-full");
        createFile(dir.resolve("a"), 1);
        SummaryFileWriter writer = writer(new SummaryConfig("dir_summary_", Set.of(), Long.MAX_VALUE));

        IOException error = assertThrows(IOException.class, () -> writer.write(dir));

        assertFalse(Files.exists(dir.resolve("dir_summary_1500000000.json")));
        assertTrue(error.getMessage().startsWith("Not enough disk space"));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1L, files.count());
        }
    }

    @Test
    void writtenSummaryIsPickedUpByAggregator() throws Exception {
        Path dir = Files.createTempDirectory("writer-aggregate");
        createFile(dir.resolve("a"), 30);
        writer(SummaryConfig.defaults()).write(dir);

        MergeResult result = new SummaryAggregator(SummaryConfig.defaults()).mergeSummaries(dir);

        long summarySize = Files.size(dir.resolve("dir_summary_1500000000.json"));
        assertEquals(30L + summarySize, result.collectedBytes());
    }

    private SummaryFileWriter writer(SummaryConfig config) {
        return new SummaryFileWriter(config, new SummaryBuilder(), codec, CLOCK);
    }
}
