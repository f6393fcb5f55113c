package im.arun.docsync.service;

import im.arun.docsync.config.MetadataReader;
import im.arun.docsync.config.ProjectMetadata;
import im.arun.docsync.config.SyncConfig;
import im.arun.docsync.discourse.DiscourseClient;
import im.arun.docsync.discourse.TopicClient;
import im.arun.docsync.discourse.TopicUrl;
import im.arun.docsync.exception.DiscourseException;
import im.arun.docsync.exception.InputException;
import im.arun.docsync.migrate.DocumentMigrator;
import im.arun.docsync.model.DiscourseConfigDescriptor;
import im.arun.docsync.model.DocNode;
import im.arun.docsync.model.MigrationReport;
import im.arun.docsync.model.RemoteTopic;
import im.arun.docsync.model.SyncReport;
import im.arun.docsync.reconcile.ReconciliationEngine;
import im.arun.docsync.scan.DocumentScanner;
import im.arun.docsync.util.JsonRunLog;
import im.arun.docsync.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Runs one synchronization: checks access, scans the docs directory, loads the index
 * topic and hands everything to the {@link ReconciliationEngine}.
 * <p>
 * When the docs directory does not exist yet but an index topic is configured, the
 * documentation is migrated from the forum into the directory instead.
 */
public class DocSyncService {
    private static final Logger logger = LoggerFactory.getLogger(DocSyncService.class);

    public static final String INDEX_TITLE_SUFFIX = " Documentation Overview";

    private final SyncConfig config;
    private final TopicClient client;
    private final DocumentScanner scanner;
    private final MetadataReader metadataReader;
    private final ReconciliationEngine engine;
    private final DocumentMigrator migrator;
    private final JsonRunLog runLog;

    public DocSyncService(SyncConfig config, Executor executor, JsonRunLog runLog) {
        this(config, new DiscourseClient(config), executor, runLog);
    }

    public DocSyncService(SyncConfig config, TopicClient client, Executor executor, JsonRunLog runLog) {
        this.config = config;
        this.client = client;
        this.scanner = new DocumentScanner();
        this.metadataReader = new MetadataReader();
        this.engine = new ReconciliationEngine(client, executor, runLog);
        this.migrator = new DocumentMigrator(client, executor, runLog);
        this.runLog = runLog;
    }

    /**
     * Stop the running synchronization before its next phase.
     */
    public void requestAbort() {
        engine.requestAbort();
    }

    /**
     * @param docsDir      root of the documentation tree
     * @param metadataFile optional {@code metadata.yaml}, may be null
     */
    public SyncReport run(Path docsDir, Path metadataFile) {
        runLog.info("Starting documentation sync", Map.of(
                "docs_path", docsDir.toString(),
                "host", config.getDiscourseHost(),
                "category_id", config.getCategoryId()));

        // Bad credentials or an unreachable host must fail before anything is read or written
        client.checkAccess();

        Optional<ProjectMetadata> metadata = metadataReader.read(metadataFile);
        DocNode root = scanner.scan(docsDir);
        logger.info("Scanned {} document(s) under {}", TreeUtils.flatten(root).size(), docsDir);

        String indexUrl = resolveIndexUrl(metadata);
        Optional<RemoteTopic> indexTopic = Optional.empty();
        if (indexUrl != null) {
            indexTopic = Optional.of(fetchIndex(indexUrl));
        }

        String indexTitle = resolveName(metadata, docsDir) + INDEX_TITLE_SUFFIX;
        ReconciliationEngine.RunOptions options = new ReconciliationEngine.RunOptions(
                config.getCategoryId(),
                config.isDeleteTopics(),
                config.isDryRun(),
                indexTitle,
                new DiscourseConfigDescriptor(config.getDiscourseHost(), config.getCategoryId(),
                        config.getApiUsername(), config.getApiKey()));

        SyncReport report = engine.reconcile(root, indexTopic, options);
        logger.info("Documentation sync finished, index at {}", report.getIndexUrl());
        return report;
    }

    /**
     * Whether {@link #migrate} applies: the docs directory is missing and an index topic is configured.
     */
    public boolean requiresMigration(Path docsDir, Path metadataFile) {
        return !Files.exists(docsDir) && resolveIndexUrl(metadataReader.read(metadataFile)) != null;
    }

    /**
     * Write the documents of the configured index topic into a new docs directory.
     *
     * @throws InputException if no index topic is configured or the directory already exists
     * @throws im.arun.docsync.exception.MigrationException if some documents could not be written
     */
    public MigrationReport migrate(Path docsDir, Path metadataFile) {
        runLog.info("Starting documentation migration", Map.of(
                "docs_path", docsDir.toString(),
                "host", config.getDiscourseHost()));

        client.checkAccess();

        if (Files.exists(docsDir)) {
            throw new InputException("Documentation directory " + docsDir + " already exists, nothing to migrate");
        }
        String indexUrl = resolveIndexUrl(metadataReader.read(metadataFile));
        if (indexUrl == null) {
            throw new InputException("No index topic is configured, there is nothing to migrate from");
        }

        MigrationReport report = migrator.migrate(fetchIndex(indexUrl), docsDir, config.isDryRun());
        logger.info("Documentation migrated from {} into {}", indexUrl, docsDir);
        return report;
    }

    private RemoteTopic fetchIndex(String indexUrl) {
        return client.fetchTopic(indexUrl).orElseThrow(() -> new InputException(
                "The index topic " + indexUrl + " does not exist on " + client.getBaseUrl()));
    }

    private String resolveIndexUrl(Optional<ProjectMetadata> metadata) {
        String indexUrl = config.getIndexUrl();
        if (isBlank(indexUrl)) {
            indexUrl = metadata.map(ProjectMetadata::getDocs).orElse(null);
        }
        if (isBlank(indexUrl)) {
            return null;
        }
        String absolute = TopicUrl.absolute(client.getBaseUrl(), indexUrl.trim());
        try {
            TopicUrl.parse(client.getBaseUrl(), absolute);
        } catch (DiscourseException e) {
            throw new InputException("Invalid index_url input: " + e.getMessage(), e);
        }
        return absolute;
    }

    private String resolveName(Optional<ProjectMetadata> metadata, Path docsDir) {
        String name = config.getDocumentationName();
        if (isBlank(name)) {
            name = metadata.map(ProjectMetadata::getName).orElse(null);
        }
        if (isBlank(name)) {
            Path absolute = docsDir.toAbsolutePath().normalize();
            Path parent = absolute.getParent();
            name = parent != null && parent.getFileName() != null
                    ? parent.getFileName().toString()
                    : String.valueOf(absolute.getFileName());
        }
        return TreeUtils.titleFromName(name.trim());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
