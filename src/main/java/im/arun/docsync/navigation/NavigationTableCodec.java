package im.arun.docsync.navigation;

import im.arun.docsync.exception.NavigationTableException;
import im.arun.docsync.model.NavigationEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the navigation table embedded in the index topic.
 * <p>
 * The table is a Markdown table introduced by a {@code # Navigation} heading:
 * <pre>
 * # Navigation
 *
 * | Level | Path | Navlink |
 * | -- | -- | -- |
 * | 1 | doc | [Doc Title](/t/doc-title/12) |
 * </pre>
 * Serialization is deterministic, so an unchanged entry list always yields the same text.
 */
public class NavigationTableCodec {
    private static final Logger logger = LoggerFactory.getLogger(NavigationTableCodec.class);

    public static final String HEADING = "# Navigation";
    static final String HEADER_ROW = "| Level | Path | Navlink |";
    static final String SEPARATOR_ROW = "| -- | -- | -- |";

    private static final Pattern HEADER_PATTERN =
            Pattern.compile("^\\|\\s*Level\\s*\\|\\s*Path\\s*\\|\\s*Navlink\\s*\\|$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEPARATOR_PATTERN =
            Pattern.compile("^\\|(\\s*:?-+:?\\s*\\|){3}$");
    private static final Pattern ROW_PATTERN = Pattern.compile(
            "^\\|\\s*(-?\\d+)\\s*\\|\\s*([^|\\s]+)\\s*\\|\\s*\\[((?:\\\\.|[^\\\\\\]])*)\\]\\((<[^>]*>|[^\\s()]*)\\)\\s*\\|$");
    private static final Pattern ESCAPED_CHAR = Pattern.compile("\\\\(.)");

    /**
     * Render the navigation table, heading included. Every line ends with a newline.
     */
    public String serialize(List<NavigationEntry> entries) {
        StringBuilder table = new StringBuilder();
        table.append(HEADING).append("\n\n");
        table.append(HEADER_ROW).append('\n');
        table.append(SEPARATOR_ROW).append('\n');
        for (NavigationEntry entry : entries) {
            table.append("| ").append(entry.getLevel())
                 .append(" | ").append(entry.getPath())
                 .append(" | [").append(escapeTitle(entry.getTitle())).append("](").append(entry.getLink()).append(")")
                 .append(" |\n");
        }
        return table.toString();
    }

    /**
     * Parse the navigation table out of an index topic body.
     *
     * @param body the raw body of the index topic, may be null
     * @return the entries in table order, empty when the body has no table
     * @throws NavigationTableException if a table is present but cannot be read unambiguously
     */
    public List<NavigationEntry> parse(String body) {
        if (body == null) {
            return new ArrayList<>();
        }

        String[] lines = body.split("\\R", -1);
        int headingIndex = findHeading(lines);
        if (headingIndex < 0) {
            logger.debug("No navigation heading found, treating index as empty");
            return new ArrayList<>();
        }

        int index = skipBlank(lines, headingIndex + 1);
        if (index >= lines.length) {
            return new ArrayList<>();
        }
        if (!HEADER_PATTERN.matcher(lines[index].trim()).matches()) {
            throw new NavigationTableException("Expected navigation table header after heading, got: " + lines[index]);
        }
        index++;
        if (index >= lines.length || !SEPARATOR_PATTERN.matcher(lines[index].trim()).matches()) {
            throw new NavigationTableException("Navigation table header is not followed by a separator row");
        }
        index++;

        List<NavigationEntry> entries = new ArrayList<>();
        Set<String> paths = new HashSet<>();
        for (; index < lines.length; index++) {
            String line = lines[index].trim();
            if (line.isEmpty()) {
                break;
            }
            NavigationEntry entry = parseRow(line);
            if (!paths.add(entry.getPath())) {
                throw new NavigationTableException("Duplicate path in navigation table: " + entry.getPath());
            }
            entries.add(entry);
        }
        return entries;
    }

    private NavigationEntry parseRow(String line) {
        Matcher matcher = ROW_PATTERN.matcher(line);
        if (!matcher.matches()) {
            throw new NavigationTableException("Invalid navigation table row: " + line);
        }
        int level;
        try {
            level = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new NavigationTableException("Invalid level in navigation table row: " + line);
        }
        if (level < 0) {
            throw new NavigationTableException("Negative level in navigation table row: " + line);
        }
        String title = ESCAPED_CHAR.matcher(matcher.group(3)).replaceAll("$1");
        try {
            return new NavigationEntry(level, matcher.group(2), title, matcher.group(4));
        } catch (IllegalArgumentException e) {
            throw new NavigationTableException("Invalid navigation table row: " + line + " (" + e.getMessage() + ")");
        }
    }

    /**
     * Locate the heading of the table. The table is always written last, so the last heading
     * followed by a table header wins over headings that belong to the index content.
     * Without such a heading the last {@code # Navigation} line is used, if any.
     */
    static int findHeading(String[] lines) {
        int lastHeading = -1;
        for (int i = lines.length - 1; i >= 0; i--) {
            if (!HEADING.equals(lines[i].trim())) {
                continue;
            }
            if (lastHeading < 0) {
                lastHeading = i;
            }
            int next = skipBlank(lines, i + 1);
            if (next < lines.length && HEADER_PATTERN.matcher(lines[next].trim()).matches()) {
                return i;
            }
        }
        return lastHeading;
    }

    private static int skipBlank(String[] lines, int from) {
        int index = from;
        while (index < lines.length && lines[index].trim().isEmpty()) {
            index++;
        }
        return index;
    }

    private static String escapeTitle(String title) {
        StringBuilder escaped = new StringBuilder(title.length());
        for (char c : title.toCharArray()) {
            if (c == '\\' || c == '|' || c == '[' || c == ']') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
