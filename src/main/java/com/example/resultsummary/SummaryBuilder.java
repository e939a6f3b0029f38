package com.example.resultsummary;

import com.example.resultsummary.summary.DirectoryNode;
import com.example.resultsummary.summary.DirectorySummary;
import com.example.resultsummary.summary.FileNode;
import com.example.resultsummary.summary.SummaryNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds a {@link DirectorySummary} from the current on-disk state of a directory.
 *
 * <p>Only original sizes are recorded. Symbolic links are followed, except links to directories that
 * resolve inside the summarized directory: results are copied back with the link itself rather than
 * its content, so such links are recorded as empty directories of size 0.
 */
public final class SummaryBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(SummaryBuilder.class);

    /**
     * Summarizes {@code directory}. The root of the returned summary is keyed by
     * {@link DirectorySummary#ROOT_NAME} regardless of the directory's own name.
     *
     * @throws NoSuchFileException if {@code directory} does not exist
     * @throws NotDirectoryException if {@code directory} is not a directory
     */
    public DirectorySummary build(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            throw new NoSuchFileException(directory.toString(), null, "Path does not exist");
        }
        if (!Files.isDirectory(directory)) {
            throw new NotDirectoryException(directory.toString());
        }
        Path topDirectory = directory.toRealPath();
        Set<Path> visited = new HashSet<>();
        visited.add(topDirectory);

        DirectoryNode root = DirectoryNode.empty();
        summarizeChildren(directory, root, topDirectory, visited);
        return DirectorySummary.of(root);
    }

    private SummaryNode summarize(Path path, Path topDirectory, Set<Path> visited) throws IOException {
        if (Files.isRegularFile(path)) {
            return FileNode.of(Files.size(path));
        }
        if (!Files.isDirectory(path)) {
            if (Files.isSymbolicLink(path)) {
                LOGGER.warn("Symlink {} does not resolve to a file or directory; recording it with size 0.", path);
            }
            return FileNode.of(0L);
        }

        DirectoryNode node = DirectoryNode.empty();
        Path realPath = path.toRealPath();
        if (Files.isSymbolicLink(path) && realPath.startsWith(topDirectory)) {
            LOGGER.debug("Not following symlink {} into summarized directory {}.", path, realPath);
            return node;
        }
        if (!visited.add(realPath)) {
            LOGGER.debug("Directory {} was already summarized; skipping {}.", realPath, path);
            return node;
        }
        summarizeChildren(path, node, topDirectory, visited);
        return node;
    }

    private void summarizeChildren(Path directory, DirectoryNode node, Path topDirectory, Set<Path> visited) throws IOException {
        Set<String> names = new TreeSet<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                names.add(entry.getFileName().toString());
            }
        }
        long originalSize = 0L;
        for (String name : names) {
            SummaryNode child = summarize(directory.resolve(name), topDirectory, visited);
            node.put(name, child);
            originalSize += child.originalSize();
        }
        node.setOriginalSize(originalSize);
    }
}
