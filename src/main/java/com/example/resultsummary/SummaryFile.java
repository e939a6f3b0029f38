package com.example.resultsummary;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;

/**
 * A summary file found on disk, ordered by modification time.
 */
public record SummaryFile(
        Path path,
        FileTime lastModifiedTime
) {
    public static final Comparator<SummaryFile> BY_MODIFIED_TIME = Comparator
            .comparing(SummaryFile::lastModifiedTime)
            .thenComparing(SummaryFile::path);

    public static SummaryFile of(Path path) throws IOException {
        return new SummaryFile(path, Files.getLastModifiedTime(path));
    }
}
