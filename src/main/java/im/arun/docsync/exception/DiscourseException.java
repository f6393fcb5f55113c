package im.arun.docsync.exception;

/**
 * A single Discourse operation failed. Only the affected topic is marked failed.
 */
public class DiscourseException extends DocSyncException {

    public DiscourseException(String message) {
        super(message);
    }

    public DiscourseException(String message, Throwable cause) {
        super(message, cause);
    }
}
