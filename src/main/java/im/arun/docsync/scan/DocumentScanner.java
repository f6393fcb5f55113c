package im.arun.docsync.scan;

import im.arun.docsync.exception.ScanException;
import im.arun.docsync.model.DocNode;
import im.arun.docsync.model.NavigationEntry;
import im.arun.docsync.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the local documentation directory into a {@link DocNode} tree.
 * <p>
 * Only Markdown files and folders are considered, hidden entries are ignored.
 * Siblings are ordered by file name. An {@code index.md} supplies the content of
 * the folder it lives in; the one in the root is the content of the index topic.
 */
public class DocumentScanner {
    private static final Logger logger = LoggerFactory.getLogger(DocumentScanner.class);

    /**
     * Scan the documentation tree.
     *
     * @param root the documentation directory
     * @return the root node, its content being the index topic content (may be null)
     * @throws ScanException if the directory is missing or any document cannot be read
     */
    public DocNode scan(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new ScanException("Documentation directory not found: " + root);
        }

        DocNode rootNode = new DocNode();
        rootNode.setRelativePath(Path.of(""));
        rootNode.setTablePath("index");
        rootNode.setDirectory(true);
        loadIndexContent(root, rootNode);
        if (rootNode.getTitle() == null) {
            rootNode.setTitle(TreeUtils.titleFromName(root.toAbsolutePath().normalize().getFileName().toString()));
        }

        Map<String, Path> seenTablePaths = new HashMap<>();
        scanChildren(root, root, rootNode, seenTablePaths);

        logger.info("Scanned {} documentation entries from {}", seenTablePaths.size(), root);
        return rootNode;
    }

    private void scanChildren(Path root, Path directory, DocNode parent, Map<String, Path> seenTablePaths) {
        for (Path entry : listSorted(directory)) {
            String name = entry.getFileName().toString();
            Path relativePath = root.relativize(entry);

            DocNode node;
            if (Files.isDirectory(entry)) {
                node = new DocNode();
                node.setDirectory(true);
                node.setRelativePath(relativePath);
                node.setTablePath(TreeUtils.toTablePath(relativePath));
                loadIndexContent(entry, node);
                if (node.getTitle() == null) {
                    node.setTitle(TreeUtils.titleFromName(name));
                }
            } else if (TreeUtils.INDEX_FILE_NAME.equals(name.toLowerCase(Locale.ROOT))) {
                // consumed as the content of the enclosing folder
                continue;
            } else {
                node = new DocNode();
                node.setRelativePath(relativePath);
                node.setTablePath(TreeUtils.toTablePath(relativePath));
                applyContent(node, readDocument(entry), name);
            }

            if (!NavigationEntry.isValidPath(node.getTablePath())) {
                throw new ScanException(String.format(
                        "Document %s cannot be listed in the navigation table, rename it without '|'",
                        relativePath));
            }

            Path clash = seenTablePaths.putIfAbsent(node.getTablePath(), relativePath);
            if (clash != null) {
                throw new ScanException(String.format(
                        "Documents %s and %s resolve to the same navigation path '%s'",
                        clash, relativePath, node.getTablePath()));
            }

            parent.addChild(node);
            if (node.isDirectory()) {
                scanChildren(root, entry, node, seenTablePaths);
            }
        }
    }

    private List<Path> listSorted(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(path -> !path.getFileName().toString().startsWith("."))
                    .filter(path -> Files.isDirectory(path) || isMarkdown(path))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ScanException("Failed to list documentation directory " + directory, e);
        }
    }

    private void loadIndexContent(Path directory, DocNode node) {
        Path indexFile = directory.resolve(TreeUtils.INDEX_FILE_NAME);
        if (Files.isRegularFile(indexFile)) {
            applyContent(node, readDocument(indexFile), null);
        }
    }

    private void applyContent(DocNode node, String content, String fileName) {
        node.setContent(content);
        node.setFingerprint(ContentFingerprint.of(content));
        String heading = TreeUtils.extractHeading(content);
        if (heading != null) {
            node.setTitle(heading);
        } else if (fileName != null) {
            node.setTitle(TreeUtils.titleFromName(fileName));
        }
    }

    private String readDocument(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScanException("Failed to read document " + file, e);
        }
    }

    private static boolean isMarkdown(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(TreeUtils.MARKDOWN_EXTENSION);
    }
}
