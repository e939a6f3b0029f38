package com.example.resultsummary;

import com.example.resultsummary.summary.DirectorySummary;

/**
 * Outcome of merging summaries: the bytes collected so far and the merged tree they were read from.
 */
public record MergeResult(
        long collectedBytes,
        DirectorySummary summary
) {
}
