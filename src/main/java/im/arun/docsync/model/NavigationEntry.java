package im.arun.docsync.model;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * One row of the navigation table held by the index topic.
 */
@Value
public class NavigationEntry {

    /** Link of a topic that would have been created outside of a dry run. */
    public static final String NOT_CREATED_LINK = "<not created due to dry run>";

    private static final Pattern INVALID_PATH = Pattern.compile(".*[\\s|].*");
    private static final Pattern INVALID_LINK = Pattern.compile(".*[\\s()].*");

    int level;
    String path;
    String title;

    /** Topic path relative to the host, empty for a group row. */
    String link;

    public NavigationEntry(int level, String path, String title, String link) {
        if (level < 0) {
            throw new IllegalArgumentException("Navigation level must not be negative, got " + level);
        }
        if (!isValidPath(path)) {
            throw new IllegalArgumentException("Invalid navigation path: '" + path + "'");
        }
        if (title == null || title.indexOf('\n') >= 0 || title.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Invalid navigation title for path " + path);
        }
        String effectiveLink = link == null ? "" : link;
        if (!NOT_CREATED_LINK.equals(effectiveLink) && INVALID_LINK.matcher(effectiveLink).matches()) {
            throw new IllegalArgumentException("Invalid navigation link: '" + link + "'");
        }
        this.level = level;
        this.path = path;
        this.title = title;
        this.link = effectiveLink;
    }

    /**
     * Whether the path can be written to a navigation table row.
     */
    public static boolean isValidPath(String path) {
        return path != null && !path.isBlank() && !INVALID_PATH.matcher(path).matches();
    }

    public static NavigationEntry group(int level, String path, String title) {
        return new NavigationEntry(level, path, title, "");
    }

    public boolean isGroup() {
        return link.isEmpty();
    }

    public boolean hasTopic() {
        return !link.isEmpty() && !NOT_CREATED_LINK.equals(link);
    }
}
