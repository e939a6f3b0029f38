package com.example.resultsummary.summary;

/**
 * A file or directory entry of a directory summary.
 *
 * <p>Every node carries an original size. The trimmed and collected sizes are optional; when absent
 * the trimmed size falls back to the original size and the collected size falls back to the trimmed
 * size.
 */
public abstract class SummaryNode {
    private long originalSize;
    private Long trimmedSize;
    private Long collectedSize;

    SummaryNode(long originalSize, Long trimmedSize, Long collectedSize) {
        this.originalSize = originalSize;
        this.trimmedSize = trimmedSize;
        this.collectedSize = collectedSize;
    }

    public abstract boolean isDirectory();

    /**
     * Returns a structural copy that shares no mutable state with this node.
     */
    public abstract SummaryNode copy();

    /**
     * Recomputes aggregate sizes from the children. No-op for files.
     */
    public void updateSizes() {
    }

    public long originalSize() {
        return originalSize;
    }

    public long trimmedSize() {
        return trimmedSize != null ? trimmedSize : originalSize;
    }

    public long collectedSize() {
        return collectedSize != null ? collectedSize : trimmedSize();
    }

    public boolean hasTrimmedSize() {
        return trimmedSize != null;
    }

    public boolean hasCollectedSize() {
        return collectedSize != null;
    }

    public void setOriginalSize(long originalSize) {
        this.originalSize = originalSize;
    }

    public void setTrimmedSize(long trimmedSize) {
        this.trimmedSize = trimmedSize;
    }

    public void setCollectedSize(long collectedSize) {
        this.collectedSize = collectedSize;
    }

    Long rawTrimmedSize() {
        return trimmedSize;
    }

    Long rawCollectedSize() {
        return collectedSize;
    }
}
