package im.arun.docsync.exception;

/**
 * Thrown when the supplied configuration is missing a value or holds an invalid one.
 * Raised before any remote call is made.
 */
public class InputException extends DocSyncException {

    public InputException(String message) {
        super(message);
    }

    public InputException(String message, Throwable cause) {
        super(message, cause);
    }
}
