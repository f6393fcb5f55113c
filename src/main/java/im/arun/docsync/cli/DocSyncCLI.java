package im.arun.docsync.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.docsync.config.ConfigLoader;
import im.arun.docsync.config.MetadataReader;
import im.arun.docsync.config.SyncConfig;
import im.arun.docsync.exception.DocSyncException;
import im.arun.docsync.exception.InputException;
import im.arun.docsync.exception.MigrationException;
import im.arun.docsync.exception.ScanException;
import im.arun.docsync.exception.SyncAbortedException;
import im.arun.docsync.model.SyncReport;
import im.arun.docsync.service.DocSyncService;
import im.arun.docsync.util.ExecutorProvider;
import im.arun.docsync.util.JsonRunLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point. Prints the sync report as JSON on stdout, or writes it to {@code --output}.
 * When the docs directory is missing and an index topic is known, the documentation is
 * migrated from the forum into it and the migration report is printed instead.
 * <p>
 * Exit codes: 0 when the run completed (individual topics may still have failed),
 * 1 when the run was aborted, 2 when the input was invalid.
 */
@Command(
    name = "docsync",
    description = "Synchronize a documentation directory with Discourse topics and a navigation index",
    mixinStandardHelpOptions = true,
    version = "docsync 1.0"
)
public class DocSyncCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(DocSyncCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ABORTED = 1;
    static final int EXIT_INVALID_INPUT = 2;

    @Option(names = {"--docs-path"}, description = "Directory holding the documentation (default: docs)")
    private String docsPath;

    @Option(names = {"--discourse-host"}, description = "Discourse host name, without protocol", required = true)
    private String discourseHost;

    @Option(names = {"--api-username"}, description = "Discourse API user (or set DISCOURSE_API_USERNAME env var)")
    private String apiUsername;

    @Option(names = {"--api-key"}, description = "Discourse API key (or set DISCOURSE_API_KEY env var)")
    private String apiKey;

    @Option(names = {"--category-id"}, description = "Category new topics are created in (default: 41)")
    private Integer categoryId;

    @Option(names = {"--delete-topics"}, description = "Delete topics of removed documents (true/false)", arity = "1")
    private Boolean deleteTopics;

    @Option(names = {"--dry-run"}, description = "Plan and report without changing anything on the server")
    private boolean dryRun;

    @Option(names = {"--index-url"}, description = "URL of the existing index topic (default: docs key of metadata.yaml)")
    private String indexUrl;

    @Option(names = {"--name"}, description = "Documentation name used in the index topic title")
    private String documentationName;

    @Option(names = {"--metadata"}, description = "Path to metadata.yaml", defaultValue = MetadataReader.METADATA_FILE_NAME)
    private String metadataPath;

    @Option(names = {"--config"}, description = "YAML file replacing the bundled defaults")
    private String configPath;

    @Option(names = {"--max-concurrency"}, description = "Concurrent requests against the server")
    private Integer maxConcurrency;

    @Option(names = {"--max-retries"}, description = "Attempts per request before giving up")
    private Integer maxRetries;

    @Option(names = {"--output"}, description = "Output JSON file path")
    private String outputPath;

    @Option(names = {"--log-dir"}, description = "Directory for the JSON run log")
    private String logDir;

    @Override
    public Integer call() throws Exception {
        SyncConfig config;
        try {
            config = new ConfigLoader(configPath).load(userOptions());
        } catch (InputException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        ExecutorProvider.configure(config.getMaxConcurrency());
        JsonRunLog runLog = new JsonRunLog(logDir != null ? Paths.get(logDir) : null);
        DocSyncService service = new DocSyncService(config, ExecutorProvider.getExecutor(), runLog);

        CountDownLatch finished = new CountDownLatch(1);
        Thread abortHook = new Thread(() -> {
            if (finished.getCount() > 0) {
                logger.warn("Interrupted, stopping after the current phase");
                service.requestAbort();
                try {
                    finished.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }, "docsync-abort");
        Runtime.getRuntime().addShutdownHook(abortHook);

        Path docsDir = Paths.get(config.getDocsPath());
        Path metadataFile = Paths.get(metadataPath);
        try {
            if (service.requiresMigration(docsDir, metadataFile)) {
                writeReport(service.migrate(docsDir, metadataFile));
                return EXIT_OK;
            }
            SyncReport report = service.run(docsDir, metadataFile);
            writeReport(report);
            if (report.hasFailures()) {
                System.err.println("Some topics failed to sync, see the report for details");
            }
            return EXIT_OK;
        } catch (InputException | ScanException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (SyncAbortedException e) {
            System.err.println("Error: " + e.getMessage());
            writeReport(e.getPartialReport());
            return EXIT_ABORTED;
        } catch (MigrationException e) {
            System.err.println("Error: " + e.getMessage());
            writeReport(e.getPartialReport());
            return EXIT_ABORTED;
        } catch (DocSyncException e) {
            System.err.println("Error: " + e.getMessage());
            logger.debug("Sync failed", e);
            return EXIT_ABORTED;
        } finally {
            runLog.flush();
            finished.countDown();
            removeHook(abortHook);
        }
    }

    private Map<String, Object> userOptions() {
        Map<String, Object> options = new HashMap<>();
        options.put("discourseHost", discourseHost);
        options.put("apiUsername", apiUsername);
        options.put("apiKey", apiKey);
        options.put("categoryId", categoryId);
        options.put("deleteTopics", deleteTopics);
        options.put("docsPath", docsPath);
        options.put("indexUrl", indexUrl);
        options.put("documentationName", documentationName);
        options.put("maxConcurrency", maxConcurrency);
        options.put("maxRetries", maxRetries);
        if (dryRun) {
            options.put("dryRun", true);
        }
        return options;
    }

    private void writeReport(Object report) throws IOException {
        if (report == null) {
            return;
        }
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        String jsonOutput = mapper.writeValueAsString(report);

        if (outputPath != null) {
            Path outputFilePath = Paths.get(outputPath);
            Files.writeString(outputFilePath, jsonOutput);
            System.err.println("Report written to: " + outputPath);
        } else {
            System.out.println(jsonOutput);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down, the hook is running
            logger.debug("Shutdown in progress, abort hook stays registered");
        }
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new CommandLine(new DocSyncCLI()).execute(args);
        } finally {
            ExecutorProvider.shutdown();
        }
        System.exit(exitCode);
    }
}
