package com.example.resultsummary;

import com.example.resultsummary.summary.DirectorySummary;
import com.example.resultsummary.summary.SummaryCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Saves the summary of a directory into that directory as a timestamped JSON file.
 */
public final class SummaryFileWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(SummaryFileWriter.class);

    private final SummaryConfig config;
    private final SummaryBuilder builder;
    private final SummaryCodec codec;
    private final Clock clock;

    public SummaryFileWriter(SummaryConfig config) {
        this(config, new SummaryBuilder(), new SummaryCodec(), Clock.systemUTC());
    }

    SummaryFileWriter(SummaryConfig config, SummaryBuilder builder, SummaryCodec codec, Clock clock) {
        this.config = config;
        this.builder = builder;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Summarizes {@code directory} and writes the summary to a new file inside it.
     *
     * @return the summary file written
     * @throws IOException if the directory cannot be summarized, or if writing the summary would leave
     *                     less than the configured free disk space
     */
    public Path write(Path directory) throws IOException {
        DirectorySummary summary = builder.build(directory);
        byte[] json = codec.toJson(summary).getBytes(StandardCharsets.UTF_8);

        long freeSpace = Files.getFileStore(directory).getUsableSpace();
        if (freeSpace - json.length < config.minFreeDiskBytes()) {
            throw new IOException(String.format(
                    "Not enough disk space after saving the summary file. Available free disk: %d bytes. "
                            + "Summary file size: %d bytes.", freeSpace, json.length));
        }

        Path tempFile = Files.createTempFile(directory, ".", ".tmp");
        Path summaryFile;
        try {
            Files.write(tempFile, json);
            summaryFile = publish(tempFile, directory);
        } finally {
            Files.deleteIfExists(tempFile);
        }
        LOGGER.info("Directory summary of {} is saved to file {}.", directory, summaryFile);
        return summaryFile;
    }

    /**
     * Links the complete {@code tempFile} under the first unused summary file name for the current
     * time. Linking fails instead of replacing a file that already has the name.
     */
    private Path publish(Path tempFile, Path directory) throws IOException {
        String name = config.summaryFilePrefix() + clock.instant().getEpochSecond();
        Path candidate = directory.resolve(name + ".json");
        int count = 1;
        while (true) {
            try {
                return Files.createLink(candidate, tempFile);
            } catch (FileAlreadyExistsException ex) {
                candidate = directory.resolve(name + "_" + count + ".json");
                count++;
            }
        }
    }
}
