package com.example.resultsummary.summary;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Point-in-time summary of a directory tree.
 *
 * <p>The top level holds at most one entry, keyed by {@link #ROOT_NAME}, so that summaries taken from
 * different walk starting points line up with each other. An empty summary has no entries.
 */
public final class DirectorySummary {
    public static final String ROOT_NAME = "";

    private final SortedMap<String, SummaryNode> entries = new TreeMap<>();

    private DirectorySummary() {
    }

    public static DirectorySummary empty() {
        return new DirectorySummary();
    }

    public static DirectorySummary of(SummaryNode root) {
        DirectorySummary summary = new DirectorySummary();
        summary.entries.put(ROOT_NAME, root);
        return summary;
    }

    /**
     * Live view of the top-level entries.
     */
    public SortedMap<String, SummaryNode> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns the root node, or {@code null} for an empty summary.
     */
    public SummaryNode root() {
        return entries.get(ROOT_NAME);
    }

    public long originalBytes() {
        SummaryNode root = root();
        return root == null ? 0L : root.originalSize();
    }

    public long trimmedBytes() {
        SummaryNode root = root();
        return root == null ? 0L : root.trimmedSize();
    }

    public long collectedBytes() {
        SummaryNode root = root();
        return root == null ? 0L : root.collectedSize();
    }

    /**
     * Looks up a node by a slash-separated path relative to the root, e.g. {@code "folder1/file2"}.
     * Returns {@code null} when no such node exists.
     */
    public SummaryNode find(String relativePath) {
        SummaryNode current = root();
        if (relativePath.isEmpty()) {
            return current;
        }
        for (String name : relativePath.split("/")) {
            if (!(current instanceof DirectoryNode)) {
                return null;
            }
            current = ((DirectoryNode) current).child(name);
        }
        return current;
    }

    public DirectorySummary copy() {
        DirectorySummary copy = new DirectorySummary();
        for (Map.Entry<String, SummaryNode> entry : entries.entrySet()) {
            copy.entries.put(entry.getKey(), entry.getValue().copy());
        }
        return copy;
    }

    @Override
    public String toString() {
        return "DirectorySummary" + entries;
    }
}
