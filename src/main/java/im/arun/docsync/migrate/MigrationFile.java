package im.arun.docsync.migrate;

import im.arun.docsync.model.NavigationEntry;
import lombok.Value;

import java.nio.file.Path;

/**
 * A file the migration writes into the documentation directory.
 */
@Value
public class MigrationFile {

    public enum Kind {
        /** Content of the index topic above its navigation table. */
        INDEX,
        /** Body of a linked topic. */
        DOCUMENT,
        /** Placeholder keeping a group folder that has no documents. */
        GITKEEP
    }

    Kind kind;
    Path relativePath;

    /** Row the file comes from, null for the index file. */
    NavigationEntry entry;

    /** Known content, only set for the index file. */
    String content;

    static MigrationFile index(String content) {
        return new MigrationFile(Kind.INDEX, Path.of(MigrationPlanner.INDEX_FILE_NAME), null, content);
    }

    static MigrationFile document(Path relativePath, NavigationEntry entry) {
        return new MigrationFile(Kind.DOCUMENT, relativePath, entry, null);
    }

    static MigrationFile gitkeep(Path relativePath, NavigationEntry entry) {
        return new MigrationFile(Kind.GITKEEP, relativePath, entry, null);
    }
}
