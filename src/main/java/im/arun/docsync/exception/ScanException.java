package im.arun.docsync.exception;

/**
 * The local documentation tree could not be read completely.
 */
public class ScanException extends DocSyncException {

    public ScanException(String message) {
        super(message);
    }

    public ScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
