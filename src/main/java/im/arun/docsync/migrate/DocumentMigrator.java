package im.arun.docsync.migrate;

import im.arun.docsync.discourse.TopicClient;
import im.arun.docsync.discourse.TopicUrl;
import im.arun.docsync.exception.DiscourseException;
import im.arun.docsync.exception.FatalRemoteException;
import im.arun.docsync.exception.InputException;
import im.arun.docsync.exception.MigrationException;
import im.arun.docsync.exception.NavigationTableException;
import im.arun.docsync.model.ActionOutcome;
import im.arun.docsync.model.MigrationRecord;
import im.arun.docsync.model.MigrationReport;
import im.arun.docsync.model.RemoteTopic;
import im.arun.docsync.navigation.IndexPage;
import im.arun.docsync.navigation.NavigationTableCodec;
import im.arun.docsync.util.JsonRunLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Writes the documents linked from an index topic into a new documentation directory,
 * so that a project whose documentation only lives on the forum can start syncing from files.
 * Topics are fetched concurrently, the index file and folder placeholders are written directly.
 */
public class DocumentMigrator {
    private static final Logger logger = LoggerFactory.getLogger(DocumentMigrator.class);

    static final String EMPTY_FOLDER_REASON = "created to keep an empty group folder";

    private final TopicClient client;
    private final Executor executor;
    private final JsonRunLog runLog;
    private final NavigationTableCodec codec = new NavigationTableCodec();
    private final MigrationPlanner planner = new MigrationPlanner();

    public DocumentMigrator(TopicClient client, Executor executor, JsonRunLog runLog) {
        this.client = client;
        this.executor = executor;
        this.runLog = runLog;
    }

    /**
     * @param indexTopic the index topic to migrate from
     * @param docsDir    documentation directory to create
     * @param dryRun     plan the files without fetching or writing anything
     * @throws InputException     if the navigation table cannot be migrated
     * @throws MigrationException if some documents could not be written, carrying the rest
     */
    public MigrationReport migrate(RemoteTopic indexTopic, Path docsDir, boolean dryRun) {
        IndexPage page;
        try {
            page = IndexPage.parse(indexTopic.getBody(), codec);
        } catch (NavigationTableException e) {
            throw new InputException("The navigation table of " + indexTopic.getUrl()
                    + " cannot be migrated: " + e.getMessage(), e);
        }
        List<MigrationFile> files = planner.plan(page.getContent(), page.getEntries());
        logger.info("Migrating {} file(s) from {} into {}", files.size(), indexTopic.getUrl(), docsDir);
        runLog.info("Migration started", Map.of(
                "index_url", indexTopic.getUrl(),
                "docs_path", docsDir.toString(),
                "files", files.size(),
                "dry_run", dryRun));

        MigrationRecord[] records = new MigrationRecord[files.size()];
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            MigrationFile file = files.get(i);
            int position = i;
            if (dryRun) {
                records[i] = record(file, urlOf(file), ActionOutcome.SKIP, "not written due to dry run");
            } else if (file.getKind() == MigrationFile.Kind.DOCUMENT) {
                futures.add(CompletableFuture.runAsync(
                        () -> records[position] = migrateDocument(file, docsDir), executor));
            } else {
                records[i] = writeLocal(file, docsDir);
            }
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof FatalRemoteException) {
                throw (FatalRemoteException) e.getCause();
            }
            throw e;
        }

        MigrationReport report = new MigrationReport(docsDir.toString(), indexTopic.getUrl(), List.of(records));
        long failed = Arrays.stream(records).filter(record -> record.getOutcome() == ActionOutcome.FAIL).count();
        if (failed > 0) {
            throw new MigrationException(failed + " of " + records.length + " file(s) could not be migrated", report);
        }
        return report;
    }

    private MigrationRecord migrateDocument(MigrationFile file, Path docsDir) {
        String url = urlOf(file);
        try {
            Optional<RemoteTopic> topic = client.fetchTopic(url);
            if (topic.isEmpty()) {
                return failed(file, url, "The topic no longer exists");
            }
            write(docsDir.resolve(file.getRelativePath()), topic.get().getBody());
            return record(file, url, ActionOutcome.SUCCESS, null);
        } catch (FatalRemoteException e) {
            throw e;
        } catch (DiscourseException e) {
            return failed(file, url, e.getMessage());
        } catch (IOException e) {
            return failed(file, url, "Failed to write " + file.getRelativePath() + ": " + e.getMessage());
        }
    }

    private MigrationRecord writeLocal(MigrationFile file, Path docsDir) {
        String content = file.getKind() == MigrationFile.Kind.INDEX ? file.getContent().strip() + "\n" : "";
        try {
            write(docsDir.resolve(file.getRelativePath()), content);
        } catch (IOException e) {
            return failed(file, null, "Failed to write " + file.getRelativePath() + ": " + e.getMessage());
        }
        String message = file.getKind() == MigrationFile.Kind.GITKEEP ? EMPTY_FOLDER_REASON : null;
        return record(file, null, ActionOutcome.SUCCESS, message);
    }

    private static void write(Path target, String content) throws IOException {
        Files.createDirectories(target.getParent());
        Files.writeString(target, content, StandardCharsets.UTF_8);
    }

    private String urlOf(MigrationFile file) {
        if (file.getKind() != MigrationFile.Kind.DOCUMENT) {
            return null;
        }
        return TopicUrl.absolute(client.getBaseUrl(), file.getEntry().getLink());
    }

    private MigrationRecord failed(MigrationFile file, String url, String reason) {
        logger.error("Failed to migrate {}: {}", file.getRelativePath(), reason);
        return record(file, url, ActionOutcome.FAIL, reason);
    }

    private MigrationRecord record(MigrationFile file, String url, ActionOutcome outcome, String message) {
        String path = file.getEntry() != null ? file.getEntry().getPath() : null;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("location", file.getRelativePath().toString());
        details.put("result", outcome.toJson());
        if (url != null) {
            details.put("url", url);
        }
        if (outcome == ActionOutcome.FAIL) {
            runLog.error("File not migrated", details);
        } else {
            runLog.info("File migrated", details);
        }
        return new MigrationRecord(path, file.getRelativePath().toString().replace('\\', '/'), url, outcome, message);
    }
}
