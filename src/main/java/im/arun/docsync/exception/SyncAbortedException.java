package im.arun.docsync.exception;

import im.arun.docsync.model.SyncReport;

/**
 * The run stopped before the index was written. Carries whatever was applied so far.
 */
public class SyncAbortedException extends DocSyncException {

    private final transient SyncReport partialReport;

    public SyncAbortedException(String message, SyncReport partialReport, Throwable cause) {
        super(message, cause);
        this.partialReport = partialReport;
    }

    public SyncReport getPartialReport() {
        return partialReport;
    }
}
