package com.example.resultsummary;

import com.example.resultsummary.summary.DirectorySummary;
import com.example.resultsummary.summary.SummaryCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Merges every summary file saved in a result directory, in the order they were written, and then
 * reconciles the merged summary with the directory's current content.
 */
public final class SummaryAggregator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SummaryAggregator.class);

    private final SummaryConfig config;
    private final SummaryBuilder builder;
    private final SummaryMerger merger;
    private final SummaryCodec codec;

    public SummaryAggregator(SummaryConfig config) {
        this(config, new SummaryBuilder(), new SummaryMerger(config.ignoredFiles()), new SummaryCodec());
    }

    SummaryAggregator(SummaryConfig config, SummaryBuilder builder, SummaryMerger merger, SummaryCodec codec) {
        this.config = config;
        this.builder = builder;
        this.merger = merger;
        this.codec = codec;
    }

    /**
     * Merges all summaries under {@code directory}.
     *
     * <p>The collected byte count can be larger than the size of the directory, as files can be
     * overwritten or removed after being collected. It is 0 when no summary file exists, since nothing
     * was collected from the remote side.
     *
     * @throws IOException if the directory cannot be summarized or any summary file cannot be read;
     *                     a summary that cannot be read would corrupt the collected byte count
     */
    public MergeResult mergeSummaries(Path directory) throws IOException {
        List<SummaryFile> summaryFiles = findSummaryFiles(directory);
        LOGGER.info("Merging {} summary files under {}.", summaryFiles.size(), directory);

        DirectorySummary merged = DirectorySummary.empty();
        for (SummaryFile summaryFile : summaryFiles) {
            DirectorySummary summary = codec.read(summaryFile.path());
            merger.merge(merged, summary, false);
            LOGGER.debug("Merged {}; {} bytes collected so far.", summaryFile.path(), merged.collectedBytes());
        }

        DirectorySummary latest = builder.build(directory);
        merger.merge(merged, latest, true);
        merger.deleteMissingEntries(merged, latest);

        long collectedBytes = summaryFiles.isEmpty() ? 0L : merged.collectedBytes();
        LOGGER.info("Collected {} bytes for {}; final size {} of {} original bytes.",
                collectedBytes, directory, merged.trimmedBytes(), merged.originalBytes());
        return new MergeResult(collectedBytes, merged);
    }

    /**
     * Lists the summary files directly under {@code directory}, oldest first by modification time.
     */
    public List<SummaryFile> findSummaryFiles(Path directory) throws IOException {
        List<SummaryFile> summaryFiles = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return summaryFiles;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, config.summaryFileGlob())) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    summaryFiles.add(SummaryFile.of(path));
                }
            }
        }
        summaryFiles.sort(SummaryFile.BY_MODIFIED_TIME);
        return summaryFiles;
    }
}
