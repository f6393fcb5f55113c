package im.arun.docsync.exception;

/**
 * Discourse cannot be used at all for this run. Aborts the whole reconciliation.
 */
public abstract class FatalRemoteException extends DocSyncException {

    protected FatalRemoteException(String message) {
        super(message);
    }

    protected FatalRemoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
