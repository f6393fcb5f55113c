package im.arun.docsync.discourse;

import im.arun.docsync.exception.DiscourseException;
import lombok.Value;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Slug and identifier of a topic, taken from a URL of the form {@code <base>/t/<slug>/<id>}.
 */
@Value
public class TopicUrl {
    String slug;
    long topicId;

    /**
     * Parse and validate a topic URL.
     * <p>
     * The URL must start with the base path, have exactly three path components,
     * the first being the literal {@code t}, the second a non-empty slug and the
     * third a numeric topic id.
     *
     * @throws DiscourseException if any of the rules is violated
     */
    public static TopicUrl parse(String basePath, String url) {
        if (url == null || !url.startsWith(basePath)) {
            throw new DiscourseException(String.format(
                    "The base path is different to the expected base path, expected: %s, url=%s", basePath, url));
        }

        String path;
        try {
            path = new URI(url).getPath();
        } catch (URISyntaxException e) {
            throw new DiscourseException("Malformed topic url=" + url, e);
        }
        if (path == null) {
            throw new DiscourseException("Topic url has no path, url=" + url);
        }

        String trimmed = path.replaceAll("/+$", "");
        String[] components = trimmed.startsWith("/") ? trimmed.substring(1).split("/", -1) : trimmed.split("/", -1);
        if (components.length != 3) {
            throw new DiscourseException(String.format(
                    "Unexpected number of path components, expected: 3, got: %d, url=%s", components.length, url));
        }
        if (!"t".equals(components[0])) {
            throw new DiscourseException(String.format(
                    "Unexpected first path component, expected: 't', got: '%s', url=%s", components[0], url));
        }
        if (components[1].isEmpty()) {
            throw new DiscourseException("Empty second path component topic slug, url=" + url);
        }
        if (!components[2].matches("\\d+")) {
            throw new DiscourseException(String.format(
                    "Unexpected third path component topic id, expected an integer, got: '%s', url=%s",
                    components[2], url));
        }
        return new TopicUrl(components[1], Long.parseLong(components[2]));
    }

    public static boolean isValid(String basePath, String url) {
        try {
            parse(basePath, url);
            return true;
        } catch (DiscourseException e) {
            return false;
        }
    }

    /**
     * Turn a navigation link (a path relative to the host) into an absolute URL.
     */
    public static String absolute(String basePath, String link) {
        if (link == null || link.isEmpty() || link.startsWith("http://") || link.startsWith("https://")) {
            return link;
        }
        return basePath + (link.startsWith("/") ? link : "/" + link);
    }

    /**
     * Turn an absolute topic URL into the path stored in the navigation table.
     */
    public static String relative(String url) {
        try {
            String path = new URI(url).getPath();
            return path == null || path.isEmpty() ? url : path;
        } catch (URISyntaxException e) {
            return url;
        }
    }
}
