package im.arun.docsync.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A document or folder of the local documentation tree.
 * <p>
 * The root node stands for the documentation directory itself; its content is the
 * index topic content and it never becomes a navigation row.
 */
@Data
@NoArgsConstructor
public class DocNode {

    private Path relativePath;

    /** Identity key of the node in the navigation table, e.g. {@code nested-dir-doc}. */
    private String tablePath;

    private String title;

    /** Raw Markdown content, null for a folder without an {@code index.md}. */
    private String content;

    private String fingerprint;

    private boolean directory;

    private List<DocNode> children = new ArrayList<>();

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private DocNode parent;

    public void addChild(DocNode child) {
        child.setParent(this);
        children.add(child);
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean hasContent() {
        return content != null;
    }

    /**
     * Nesting level in the navigation table: 0 for the root, 1 for its direct children.
     */
    public int getLevel() {
        int level = 0;
        DocNode current = parent;
        while (current != null) {
            level++;
            current = current.getParent();
        }
        return level;
    }
}
