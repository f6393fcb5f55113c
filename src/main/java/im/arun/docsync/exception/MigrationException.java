package im.arun.docsync.exception;

import im.arun.docsync.model.MigrationReport;

/**
 * Some documents could not be migrated. Carries the files that were written.
 */
public class MigrationException extends DocSyncException {

    private final transient MigrationReport partialReport;

    public MigrationException(String message, MigrationReport partialReport) {
        super(message);
        this.partialReport = partialReport;
    }

    public MigrationReport getPartialReport() {
        return partialReport;
    }
}
