package im.arun.docsync.exception;

/**
 * Base type of every error raised while synchronizing documentation.
 */
public class DocSyncException extends RuntimeException {

    public DocSyncException(String message) {
        super(message);
    }

    public DocSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
