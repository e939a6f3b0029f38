package com.example.resultsummary;

import com.example.resultsummary.summary.DirectorySummary;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result sizes reported for a test run, in KB.
 *
 * <p>A test can collect the same result files from the device several times, so
 * {@code clientResultCollectedKb} can exceed {@code resultUploadedKb} even without trimming.
 */
public record ResultSizeInfo(
        @JsonProperty("client_result_collected_KB") long clientResultCollectedKb,
        @JsonProperty("original_result_total_KB") long originalResultTotalKb,
        @JsonProperty("result_uploaded_KB") long resultUploadedKb,
        @JsonProperty("result_throttled") boolean resultThrottled
) {
    public static ResultSizeInfo from(long clientCollectedBytes, DirectorySummary summary) {
        return new ResultSizeInfo(
                clientCollectedBytes / 1024,
                summary.originalBytes() / 1024,
                summary.trimmedBytes() / 1024,
                // Trimmed results mean collection was throttled.
                summary.originalBytes() != summary.trimmedBytes()
        );
    }

    public static ResultSizeInfo from(MergeResult result) {
        return from(result.collectedBytes(), result.summary());
    }
}
