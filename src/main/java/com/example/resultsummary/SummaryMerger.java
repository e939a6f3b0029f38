package com.example.resultsummary;

import com.example.resultsummary.summary.DirectoryNode;
import com.example.resultsummary.summary.DirectorySummary;
import com.example.resultsummary.summary.SummaryNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

/**
 * Merges directory summaries taken at different times into one running summary.
 *
 * <p>Files collected more than once because they changed between summaries are counted once per
 * collection, so the collected size of the merged summary can exceed its trimmed size. The overwrite
 * rules follow rsync: a directory replaces a same-named file, but a file never replaces a directory.
 */
public final class SummaryMerger {
    private final Set<String> ignoredFiles;

    public SummaryMerger() {
        this(Set.copyOf(SummaryConfig.DEFAULT_IGNORED_FILES));
    }

    /**
     * @param ignoredFiles names of files that are expected to disappear before the final summary and
     *                     are dropped, rather than trimmed, when they do
     */
    public SummaryMerger(Set<String> ignoredFiles) {
        this.ignoredFiles = Set.copyOf(ignoredFiles);
    }

    /**
     * Merges {@code latest} into {@code merged}, mutating {@code merged}. Nodes are copied out of
     * {@code latest}, never shared.
     *
     * @param isFinal true if {@code latest} was built from the final result directory
     * @return the collected bytes of the merged summary, together with {@code merged}
     */
    public MergeResult merge(DirectorySummary merged, DirectorySummary latest, boolean isFinal) {
        mergeEntries(merged.entries(), latest.entries(), isFinal);
        return new MergeResult(merged.collectedBytes(), merged);
    }

    /**
     * Marks entries of {@code merged} that no longer exist in {@code latest} as deleted: their trimmed
     * size drops to 0 while the collected size is kept. Ignored files are removed instead.
     */
    public void deleteMissingEntries(DirectorySummary merged, DirectorySummary latest) {
        deleteMissing(merged.entries(), latest.entries());
    }

    private void mergeEntries(SortedMap<String, SummaryNode> oldEntries,
                              SortedMap<String, SummaryNode> newEntries,
                              boolean isFinal) {
        for (Map.Entry<String, SummaryNode> entry : newEntries.entrySet()) {
            String name = entry.getKey();
            SummaryNode newNode = entry.getValue();
            SummaryNode oldNode = oldEntries.get(name);

            if (oldNode == null) {
                oldNode = newNode.copy();
                oldEntries.put(name, oldNode);
            } else if (newNode.isDirectory()) {
                if (!oldNode.isDirectory()) {
                    // The new directory overwrites the file; the old file's sizes are dropped.
                    oldNode = DirectoryNode.zeroed();
                    oldEntries.put(name, oldNode);
                }
                mergeEntries(((DirectoryNode) oldNode).children(), ((DirectoryNode) newNode).children(), isFinal);
            } else if (oldNode.isDirectory()) {
                // A file cannot overwrite a directory.
                continue;
            } else {
                mergeFile(oldNode, newNode, isFinal);
            }
            oldNode.updateSizes();
        }
    }

    private void mergeFile(SummaryNode oldNode, SummaryNode newNode, boolean isFinal) {
        if (newNode.originalSize() == oldNode.originalSize()) {
            return;
        }
        // The final directory holds files as uploaded, without their original size, so an equal
        // trimmed size there means the file was not collected again.
        if (isFinal && newNode.trimmedSize() == oldNode.trimmedSize()) {
            return;
        }
        oldNode.setCollectedSize(oldNode.collectedSize() + newNode.collectedSize());
        oldNode.setTrimmedSize(newNode.trimmedSize());
        oldNode.setOriginalSize(newNode.originalSize());
    }

    private void deleteMissing(SortedMap<String, SummaryNode> oldEntries, SortedMap<String, SummaryNode> newEntries) {
        Iterator<Map.Entry<String, SummaryNode>> iterator = oldEntries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, SummaryNode> entry = iterator.next();
            String name = entry.getKey();
            SummaryNode oldNode = entry.getValue();
            SummaryNode newNode = newEntries.get(name);

            if (newNode == null) {
                if (oldNode.isDirectory()) {
                    deleteMissing(((DirectoryNode) oldNode).children(), Collections.emptySortedMap());
                    oldNode.updateSizes();
                } else if (ignoredFiles.contains(name)) {
                    iterator.remove();
                } else {
                    if (!oldNode.hasCollectedSize()) {
                        oldNode.setCollectedSize(oldNode.trimmedSize());
                    }
                    oldNode.setTrimmedSize(0L);
                }
            } else if (oldNode.isDirectory()) {
                SortedMap<String, SummaryNode> newChildren = newNode.isDirectory()
                        ? ((DirectoryNode) newNode).children()
                        : Collections.emptySortedMap();
                deleteMissing(((DirectoryNode) oldNode).children(), newChildren);
                oldNode.updateSizes();
            }
        }
    }
}
