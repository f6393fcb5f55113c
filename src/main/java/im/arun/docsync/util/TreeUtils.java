package im.arun.docsync.util;

import im.arun.docsync.model.DocNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility methods for the documentation tree: naming, titles and traversal.
 */
public class TreeUtils {

    public static final String MARKDOWN_EXTENSION = ".md";
    public static final String INDEX_FILE_NAME = "index.md";

    private static final Pattern HEADING = Pattern.compile("^\\s{0,3}#{1,6}\\s+(.+?)(?:\\s+#+)?\\s*$");

    private TreeUtils() {}

    /**
     * Flatten the tree below the root in document order. The root itself is not included.
     */
    public static List<DocNode> flatten(DocNode root) {
        List<DocNode> result = new ArrayList<>();
        for (DocNode child : root.getChildren()) {
            collect(child, result);
        }
        return result;
    }

    private static void collect(DocNode node, List<DocNode> result) {
        result.add(node);
        for (DocNode child : node.getChildren()) {
            collect(child, result);
        }
    }

    /**
     * Convert a path relative to the documentation root into its navigation table path.
     * e.g. "nested-dir/doc.md" -> "nested-dir-doc"
     */
    public static String toTablePath(Path relativePath) {
        List<String> parts = new ArrayList<>();
        for (Path part : relativePath) {
            parts.add(stripExtension(part.toString()));
        }
        return String.join("-", parts).replaceAll("\\s+", "-").toLowerCase(Locale.ROOT);
    }

    /**
     * Title of the first Markdown heading in the content, or null when there is none.
     */
    public static String extractHeading(String content) {
        if (content == null) {
            return null;
        }
        for (String line : content.split("\\R")) {
            Matcher matcher = HEADING.matcher(line);
            if (matcher.matches()) {
                return matcher.group(1).trim();
            }
        }
        return null;
    }

    /**
     * Derive a display title from a file or folder name.
     * e.g. "nested-dir" -> "Nested Dir", "getting_started.md" -> "Getting Started"
     */
    public static String titleFromName(String name) {
        String base = stripExtension(name).replace('-', ' ').replace('_', ' ').trim();
        StringBuilder title = new StringBuilder();
        for (String word : base.split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.toString();
    }

    private static String stripExtension(String name) {
        if (name.toLowerCase(Locale.ROOT).endsWith(MARKDOWN_EXTENSION)) {
            return name.substring(0, name.length() - MARKDOWN_EXTENSION.length());
        }
        return name;
    }
}
