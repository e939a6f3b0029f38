package com.example.resultsummary;

import java.util.List;
import java.util.Set;

/**
 * Immutable runtime settings for building and merging directory summaries.
 */
public record SummaryConfig(
        String summaryFilePrefix,
        Set<String> ignoredFiles,
        long minFreeDiskBytes
) {
    public static final String DEFAULT_SUMMARY_FILE_PREFIX = "dir_summary_";
    // Process state files that are removed from the results before upload.
    public static final List<String> DEFAULT_IGNORED_FILES = List.of("control.autoserv.state");
    public static final long DEFAULT_MIN_FREE_DISK_BYTES = 10L * 1024 * 1024;

    public SummaryConfig {
        ignoredFiles = Set.copyOf(ignoredFiles);
    }

    public static SummaryConfig defaults() {
        return new SummaryConfig(DEFAULT_SUMMARY_FILE_PREFIX, Set.copyOf(DEFAULT_IGNORED_FILES), DEFAULT_MIN_FREE_DISK_BYTES);
    }

    /**
     * Glob matching the summary files written with {@link #summaryFilePrefix()}.
     */
    public String summaryFileGlob() {
        return summaryFilePrefix + "*.json";
    }
}
