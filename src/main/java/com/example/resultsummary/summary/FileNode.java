package com.example.resultsummary.summary;

public final class FileNode extends SummaryNode {

    public FileNode(long originalSize, Long trimmedSize, Long collectedSize) {
        super(originalSize, trimmedSize, collectedSize);
    }

    public static FileNode of(long originalSize) {
        return new FileNode(originalSize, null, null);
    }

    @Override
    public boolean isDirectory() {
        return false;
    }

    @Override
    public FileNode copy() {
        return new FileNode(originalSize(), rawTrimmedSize(), rawCollectedSize());
    }

    @Override
    public String toString() {
        return "FileNode{original=" + originalSize() + ", trimmed=" + trimmedSize()
                + ", collected=" + collectedSize() + "}";
    }
}
