package im.arun.docsync.navigation;

import im.arun.docsync.model.NavigationEntry;
import lombok.Value;

import java.util.List;

/**
 * Body of the index topic: the index content followed by the navigation table.
 */
@Value
public class IndexPage {
    String content;
    List<NavigationEntry> entries;

    /**
     * Render the body written to the index topic.
     */
    public String render(NavigationTableCodec codec) {
        String table = codec.serialize(entries);
        if (content == null || content.isBlank()) {
            return table;
        }
        return content.strip() + "\n\n" + table;
    }

    /**
     * Split an index topic body into its content and navigation entries.
     *
     * @throws im.arun.docsync.exception.NavigationTableException if the table is malformed
     */
    public static IndexPage parse(String body, NavigationTableCodec codec) {
        if (body == null) {
            return new IndexPage("", List.of());
        }
        String[] lines = body.split("\\R", -1);
        int headingIndex = NavigationTableCodec.findHeading(lines);
        String content = headingIndex < 0
                ? body.strip()
                : String.join("\n", List.of(lines).subList(0, headingIndex)).strip();
        return new IndexPage(content, List.copyOf(codec.parse(body)));
    }
}
