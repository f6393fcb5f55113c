package im.arun.docsync.migrate;

import im.arun.docsync.exception.InputException;
import im.arun.docsync.model.NavigationEntry;
import im.arun.docsync.util.TreeUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the navigation table of an index topic into the files of a documentation directory.
 * <p>
 * Group rows become folders. A linked row followed by deeper rows is a folder whose
 * {@code index.md} holds the topic, any other linked row is a {@code .md} file. Group
 * folders without rows below them get a {@code .gitkeep}. File names drop the prefix
 * made of the enclosing folder names, so scanning the result yields the same paths.
 */
public class MigrationPlanner {

    public static final String INDEX_FILE_NAME = TreeUtils.INDEX_FILE_NAME;
    public static final String GITKEEP_FILE_NAME = ".gitkeep";

    /**
     * @param indexContent content of the index topic above the table, may be blank
     * @param entries      rows of the navigation table in table order
     * @throws InputException if the levels of the table do not describe a tree
     */
    public List<MigrationFile> plan(String indexContent, List<NavigationEntry> entries) {
        List<MigrationFile> files = new ArrayList<>();
        if (indexContent != null && !indexContent.isBlank()) {
            files.add(MigrationFile.index(indexContent));
        }

        // folders.size() is the level of the innermost open folder
        List<Path> folders = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            NavigationEntry entry = entries.get(i);
            validateLevel(entry, folders.size(), i == 0);
            while (folders.size() >= entry.getLevel()) {
                folders.remove(folders.size() - 1);
            }

            Path parent = folders.isEmpty() ? Path.of("") : folders.get(folders.size() - 1);
            String name = fileName(entry, parent);
            boolean hasChildren = i + 1 < entries.size() && entries.get(i + 1).getLevel() > entry.getLevel();

            if (entry.hasTopic() && !hasChildren) {
                files.add(MigrationFile.document(parent.resolve(name + TreeUtils.MARKDOWN_EXTENSION), entry));
                continue;
            }

            Path folder = parent.resolve(name);
            folders.add(folder);
            if (entry.hasTopic()) {
                files.add(MigrationFile.document(folder.resolve(INDEX_FILE_NAME), entry));
            } else if (!hasChildren) {
                files.add(MigrationFile.gitkeep(folder.resolve(GITKEEP_FILE_NAME), entry));
            }
        }
        return files;
    }

    private static void validateLevel(NavigationEntry entry, int folderLevel, boolean firstRow) {
        if (firstRow && entry.getLevel() != 1) {
            throw new InputException(String.format(
                    "Invalid starting row level, a table row must start with level value 1, got %d at '%s'. "
                            + "Please fix the index topic first and re-run", entry.getLevel(), entry.getPath()));
        }
        if (entry.getLevel() < 1) {
            throw new InputException(String.format(
                    "Invalid row level at '%s', zero or negative level value is invalid", entry.getPath()));
        }
        if (entry.getLevel() > folderLevel + 1) {
            throw new InputException(String.format(
                    "Invalid row level value sequence at '%s', level sequence jumps of more than 1 is invalid",
                    entry.getPath()));
        }
    }

    /**
     * e.g. row "group-1-doc-1" inside folder "group-1" -> "doc-1". A row that does not carry
     * the folder prefix keeps its whole path.
     */
    static String fileName(NavigationEntry entry, Path parent) {
        String path = entry.getPath();
        String name = path;
        if (parent.getNameCount() > 0 && !parent.toString().isEmpty()) {
            List<String> parts = new ArrayList<>();
            parent.forEach(part -> parts.add(part.toString()));
            String prefix = String.join("-", parts) + "-";
            if (path.startsWith(prefix) && path.length() > prefix.length()) {
                name = path.substring(prefix.length());
            }
        }
        if (name.equals(".") || name.equals("..") || name.indexOf('/') >= 0 || name.indexOf('\\') >= 0) {
            throw new InputException("Navigation path '" + path + "' cannot be used as a file name");
        }
        return name;
    }
}
