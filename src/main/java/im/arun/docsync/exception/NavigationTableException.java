package im.arun.docsync.exception;

/**
 * The navigation table of the index topic cannot be parsed unambiguously.
 * Callers treat the table as absent.
 */
public class NavigationTableException extends DocSyncException {

    public NavigationTableException(String message) {
        super(message);
    }
}
