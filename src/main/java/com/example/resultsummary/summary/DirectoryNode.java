package com.example.resultsummary.summary;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Directory entry. Children are kept ordered by name and are owned exclusively by this node.
 */
public final class DirectoryNode extends SummaryNode {
    private final SortedMap<String, SummaryNode> children = new TreeMap<>();

    public DirectoryNode(long originalSize, Long trimmedSize, Long collectedSize) {
        super(originalSize, trimmedSize, collectedSize);
    }

    /**
     * Creates a directory with no children that only carries an original size of 0, as a snapshot
     * records it.
     */
    public static DirectoryNode empty() {
        return new DirectoryNode(0L, null, null);
    }

    /**
     * Creates a directory with no children and all three sizes explicitly set to 0. Used when a
     * directory replaces a same-named file.
     */
    public static DirectoryNode zeroed() {
        return new DirectoryNode(0L, 0L, 0L);
    }

    @Override
    public boolean isDirectory() {
        return true;
    }

    /**
     * Live view of the children, keyed by entry name.
     */
    public SortedMap<String, SummaryNode> children() {
        return children;
    }

    public DirectoryNode put(String name, SummaryNode child) {
        children.put(name, child);
        return this;
    }

    public SummaryNode child(String name) {
        return children.get(name);
    }

    @Override
    public void updateSizes() {
        long original = 0L;
        long trimmed = 0L;
        long collected = 0L;
        for (SummaryNode child : children.values()) {
            original += child.originalSize();
            trimmed += child.trimmedSize();
            collected += child.collectedSize();
        }
        setOriginalSize(original);
        setTrimmedSize(trimmed);
        setCollectedSize(collected);
    }

    @Override
    public DirectoryNode copy() {
        DirectoryNode copy = new DirectoryNode(originalSize(), rawTrimmedSize(), rawCollectedSize());
        for (Map.Entry<String, SummaryNode> entry : children.entrySet()) {
            copy.children.put(entry.getKey(), entry.getValue().copy());
        }
        return copy;
    }

    @Override
    public String toString() {
        return "DirectoryNode{original=" + originalSize() + ", trimmed=" + trimmedSize()
                + ", collected=" + collectedSize() + ", children=" + children + "}";
    }
}
