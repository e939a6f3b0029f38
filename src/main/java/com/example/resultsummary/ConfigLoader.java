package com.example.resultsummary;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class ConfigLoader {
    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public SummaryConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        String prefix = optionalString(raw.summaryFilePrefix, SummaryConfig.DEFAULT_SUMMARY_FILE_PREFIX);
        if (prefix.contains("/") || prefix.contains("\\") || prefix.contains("*") || prefix.contains("?")) {
            throw new IllegalArgumentException("summaryFilePrefix must be a plain file name prefix: " + prefix);
        }
        long minFreeDiskBytes = raw.minFreeDiskBytes != null
                ? raw.minFreeDiskBytes
                : SummaryConfig.DEFAULT_MIN_FREE_DISK_BYTES;
        if (minFreeDiskBytes < 0) {
            throw new IllegalArgumentException("minFreeDiskBytes must not be negative: " + minFreeDiskBytes);
        }
        Set<String> ignoredFiles = mergeNames(SummaryConfig.DEFAULT_IGNORED_FILES, raw.ignoredFiles);

        return new SummaryConfig(prefix, ignoredFiles, minFreeDiskBytes);
    }

    private Set<String> mergeNames(List<String> defaults, List<String> overrides) {
        Set<String> merged = new LinkedHashSet<>(defaults);
        if (overrides != null) {
            for (String name : overrides) {
                if (name == null || name.isBlank()) {
                    continue;
                }
                merged.add(name);
            }
        }
        return merged;
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String summaryFilePrefix;
        public List<String> ignoredFiles;
        public Long minFreeDiskBytes;
    }
}
