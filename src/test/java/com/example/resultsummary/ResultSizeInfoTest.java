package com.example.resultsummary;

import com.example.resultsummary.summary.DirectoryNode;
import com.example.resultsummary.summary.DirectorySummary;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultSizeInfoTest {
    @Test
    void convertsRootSizesToKilobytes() {
        DirectorySummary summary = DirectorySummary.of(new DirectoryNode(20480L, 4096L, 30720L));

        ResultSizeInfo info = ResultSizeInfo.from(new MergeResult(40960L, summary));

        assertEquals(40L, info.clientResultCollectedKb());
        assertEquals(20L, info.originalResultTotalKb());
        assertEquals(4L, info.resultUploadedKb());
        assertTrue(info.resultThrottled());
    }

    @Test
    void untrimmedResultsAreNotThrottled() {
        DirectorySummary summary = DirectorySummary.of(new DirectoryNode(3000L, null, null));

        ResultSizeInfo info = ResultSizeInfo.from(5000L, summary);

        assertEquals(4L, info.clientResultCollectedKb());
        assertEquals(2L, info.originalResultTotalKb());
        assertEquals(2L, info.resultUploadedKb());
        assertFalse(info.resultThrottled());
    }

    @Test
    void emptySummaryReportsZeros() {
        ResultSizeInfo info = ResultSizeInfo.from(0L, DirectorySummary.empty());

        assertEquals(new ResultSizeInfo(0L, 0L, 0L, false), info);
    }

    @Test
    void serializesWithKeyvalNames() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        JsonNode json = mapper.readTree(mapper.writeValueAsString(new ResultSizeInfo(1L, 2L, 3L, true)));

        assertEquals(1L, json.get("client_result_collected_KB").asLong());
        assertEquals(2L, json.get("original_result_total_KB").asLong());
        assertEquals(3L, json.get("result_uploaded_KB").asLong());
        assertTrue(json.get("result_throttled").asBoolean());
    }
}
