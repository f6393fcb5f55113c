package im.arun.docsync.reconcile;

import im.arun.docsync.discourse.TopicClient;
import im.arun.docsync.discourse.TopicUrl;
import im.arun.docsync.exception.DiscourseException;
import im.arun.docsync.exception.FatalRemoteException;
import im.arun.docsync.exception.NavigationTableException;
import im.arun.docsync.exception.SyncAbortedException;
import im.arun.docsync.model.ActionKind;
import im.arun.docsync.model.ActionOutcome;
import im.arun.docsync.model.ActionRecord;
import im.arun.docsync.model.DiscourseConfigDescriptor;
import im.arun.docsync.model.DocNode;
import im.arun.docsync.model.NavigationEntry;
import im.arun.docsync.model.RemoteTopic;
import im.arun.docsync.model.SyncAction;
import im.arun.docsync.model.SyncReport;
import im.arun.docsync.navigation.IndexPage;
import im.arun.docsync.navigation.NavigationTableCodec;
import im.arun.docsync.report.ResultReporter;
import im.arun.docsync.scan.ContentFingerprint;
import im.arun.docsync.util.JsonRunLog;
import im.arun.docsync.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Brings the forum in line with the local documentation tree.
 * <p>
 * The index topic is read once at the start and written once at the end, after every
 * topic change has settled, so its navigation table never links a topic that does not
 * exist yet or was just deleted.
 */
public class ReconciliationEngine {
    private static final Logger logger = LoggerFactory.getLogger(ReconciliationEngine.class);

    public static final String INDEX_PATH = "index";
    static final int INDEX_SEQUENCE = Integer.MAX_VALUE;

    private final TopicClient client;
    private final Executor executor;
    private final NavigationTableCodec codec;
    private final ReconciliationPlanner planner;
    private final JsonRunLog runLog;
    private final AtomicBoolean abortRequested = new AtomicBoolean(false);

    public ReconciliationEngine(TopicClient client, Executor executor, JsonRunLog runLog) {
        this.client = client;
        this.executor = executor;
        this.runLog = runLog;
        this.codec = new NavigationTableCodec();
        this.planner = new ReconciliationPlanner();
    }

    /**
     * What the engine needs to know about a run beyond the tree and the index topic.
     */
    public static class RunOptions {
        final int categoryId;
        final boolean deleteTopics;
        final boolean dryRun;
        final String indexTitle;
        final DiscourseConfigDescriptor descriptor;

        public RunOptions(int categoryId, boolean deleteTopics, boolean dryRun,
                          String indexTitle, DiscourseConfigDescriptor descriptor) {
            this.categoryId = categoryId;
            this.deleteTopics = deleteTopics;
            this.dryRun = dryRun;
            this.indexTitle = indexTitle;
            this.descriptor = descriptor;
        }
    }

    /**
     * Ask a running reconciliation to stop before its next phase.
     */
    public void requestAbort() {
        abortRequested.set(true);
    }

    /**
     * Reconcile the tree against the forum.
     *
     * @param root       the scanned documentation tree; its content is the index content
     * @param indexTopic the existing index topic, empty when none has been created yet
     * @param options    policies and identity of the run
     * @return the report; per-topic failures are recorded in it
     * @throws SyncAbortedException if a fatal error or an abort request stopped the run
     *                              after changes may have been made
     * @throws FatalRemoteException if the forum became unusable before any change
     */
    public SyncReport reconcile(DocNode root, Optional<RemoteTopic> indexTopic, RunOptions options) {
        ResultReporter reporter = new ResultReporter();
        runLog.info("Reconciliation started", Map.of(
                "dry_run", options.dryRun,
                "delete_topics", options.deleteTopics,
                "index_url", indexTopic.map(RemoteTopic::getUrl).orElse("none")));

        List<NavigationEntry> priorEntries = readPriorEntries(indexTopic);

        Map<String, RemoteTopic> remoteTopics = new ConcurrentHashMap<>();
        Map<String, String> fetchFailures = new ConcurrentHashMap<>();
        fetchRemoteTopics(root, priorEntries, remoteTopics, fetchFailures);

        List<SyncAction> actions = planner.plan(root, priorEntries, remoteTopics, fetchFailures, options.deleteTopics);

        ActionExecutor actionExecutor = new ActionExecutor(client, executor, reporter, runLog,
                options.categoryId, options.dryRun, options.deleteTopics);
        ActionExecutor.ExecutionResult result = actionExecutor.apply(actions, abortRequested::get);

        String existingIndexUrl = indexTopic.map(RemoteTopic::getUrl).orElse(null);
        if (!result.isComplete()) {
            String reason = result.getFatal() != null
                    ? "Reconciliation aborted: " + result.getFatal().getMessage()
                    : "Reconciliation aborted on request";
            reporter.record(new ActionRecord(INDEX_SEQUENCE, INDEX_PATH, existingIndexUrl,
                    indexTopic.isPresent() ? ActionKind.UPDATE : ActionKind.CREATE, ActionOutcome.FAIL,
                    "index not written, the next run rebuilds it"));
            runLog.error(reason, Map.of());
            throw new SyncAbortedException(reason, reporter.build(existingIndexUrl, options.descriptor), result.getFatal());
        }

        List<NavigationEntry> entries = buildEntries(actions, reporter);
        String body = new IndexPage(root.getContent(), entries).render(codec);
        String indexUrl = writeIndex(indexTopic, body, options, reporter);

        SyncReport report = reporter.build(indexUrl, options.descriptor);
        runLog.info("Reconciliation finished", Map.of(
                "topics", report.getUrlsWithActions().size(),
                "failures", report.hasFailures()));
        return report;
    }

    private List<NavigationEntry> readPriorEntries(Optional<RemoteTopic> indexTopic) {
        if (indexTopic.isEmpty()) {
            return List.of();
        }
        try {
            return IndexPage.parse(indexTopic.get().getBody(), codec).getEntries();
        } catch (NavigationTableException e) {
            logger.warn("Navigation table of {} is malformed, treating it as empty: {}",
                    indexTopic.get().getUrl(), e.getMessage());
            runLog.warn("Malformed navigation table", Map.of("reason", e.getMessage()));
            return List.of();
        }
    }

    private void fetchRemoteTopics(DocNode root,
                                   List<NavigationEntry> priorEntries,
                                   Map<String, RemoteTopic> remoteTopics,
                                   Map<String, String> fetchFailures) {
        Map<String, NavigationEntry> priorByPath = new HashMap<>();
        priorEntries.forEach(entry -> priorByPath.putIfAbsent(entry.getPath(), entry));

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (DocNode node : TreeUtils.flatten(root)) {
            NavigationEntry prior = priorByPath.get(node.getTablePath());
            if (!node.hasContent() || prior == null || !prior.hasTopic()) {
                continue;
            }
            String url = TopicUrl.absolute(client.getBaseUrl(), prior.getLink());
            if (!TopicUrl.isValid(client.getBaseUrl(), url)) {
                logger.warn("Ignoring invalid topic link {} for {}", prior.getLink(), node.getTablePath());
                continue;
            }
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    client.fetchTopic(url).ifPresent(topic -> remoteTopics.put(node.getTablePath(), topic));
                } catch (DiscourseException e) {
                    logger.error("Failed to fetch {} for {}: {}", url, node.getTablePath(), e.getMessage());
                    fetchFailures.put(node.getTablePath(), e.getMessage());
                }
            }, executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            // Nothing has been changed yet, fatal errors surface as they are
            if (e.getCause() instanceof FatalRemoteException) {
                throw (FatalRemoteException) e.getCause();
            }
            throw e;
        }
    }

    /**
     * Rows of the new navigation table, in the order of the plan.
     */
    List<NavigationEntry> buildEntries(List<SyncAction> actions, ResultReporter reporter) {
        List<NavigationEntry> entries = new ArrayList<>();
        for (SyncAction action : actions) {
            ActionRecord record = reporter.get(action.getSequence());
            NavigationEntry prior = action.getPriorEntry();
            boolean local = action.getNode() != null;

            if (!local) {
                // Removed locally: only a topic that could not be deleted stays linked
                if (action.getKind() == ActionKind.DELETE && !action.isGroup()
                        && record.getOutcome() == ActionOutcome.FAIL) {
                    entries.add(prior);
                }
                continue;
            }

            if (action.isGroup()) {
                entries.add(NavigationEntry.group(action.getLevel(), action.getPath(), action.getTitle()));
                continue;
            }

            switch (action.getKind()) {
                case CREATE:
                    if (record.getOutcome() == ActionOutcome.SUCCESS) {
                        entries.add(entry(action, TopicUrl.relative(record.getUrl())));
                    } else if (record.getOutcome() == ActionOutcome.SKIP) {
                        entries.add(entry(action, NavigationEntry.NOT_CREATED_LINK));
                    }
                    break;
                case DELETE:
                    entries.add(record.getOutcome() == ActionOutcome.FAIL
                            ? entry(action, prior.getLink())
                            : NavigationEntry.group(action.getLevel(), action.getPath(), action.getTitle()));
                    break;
                case SKIP:
                    entries.add(action.isUnlinkOnly()
                            ? NavigationEntry.group(action.getLevel(), action.getPath(), action.getTitle())
                            : entry(action, prior.getLink()));
                    break;
                default:
                    entries.add(entry(action, prior.getLink()));
            }
        }
        return entries;
    }

    private static NavigationEntry entry(SyncAction action, String link) {
        return new NavigationEntry(action.getLevel(), action.getPath(), action.getTitle(), link);
    }

    private String writeIndex(Optional<RemoteTopic> indexTopic, String body, RunOptions options, ResultReporter reporter) {
        if (indexTopic.isEmpty()) {
            if (options.dryRun) {
                record(reporter, NavigationEntry.NOT_CREATED_LINK, ActionKind.CREATE, ActionOutcome.SKIP, "dry run");
                return null;
            }
            try {
                RemoteTopic created = client.createTopic(options.categoryId, options.indexTitle, body);
                record(reporter, created.getUrl(), ActionKind.CREATE, ActionOutcome.SUCCESS, null);
                return created.getUrl();
            } catch (DiscourseException e) {
                logger.error("Failed to create the index topic: {}", e.getMessage());
                record(reporter, null, ActionKind.CREATE, ActionOutcome.FAIL, e.getMessage());
                return null;
            } catch (FatalRemoteException e) {
                throw abortedAtIndex(e, null, reporter, options);
            }
        }

        RemoteTopic index = indexTopic.get();
        String fingerprint = ContentFingerprint.of(body);
        if (fingerprint.equals(index.getFingerprint())) {
            record(reporter, index.getUrl(), ActionKind.SKIP, ActionOutcome.SUCCESS, null);
            return index.getUrl();
        }
        if (options.dryRun) {
            record(reporter, index.getUrl(), ActionKind.UPDATE, ActionOutcome.SKIP, "dry run");
            return index.getUrl();
        }
        try {
            client.updateTopic(index.getTopicId(), body);
            record(reporter, index.getUrl(), ActionKind.UPDATE, ActionOutcome.SUCCESS, null);
        } catch (DiscourseException e) {
            logger.error("Failed to update the index topic {}: {}", index.getUrl(), e.getMessage());
            record(reporter, index.getUrl(), ActionKind.UPDATE, ActionOutcome.FAIL, e.getMessage());
        } catch (FatalRemoteException e) {
            throw abortedAtIndex(e, index.getUrl(), reporter, options);
        }
        return index.getUrl();
    }

    private SyncAbortedException abortedAtIndex(FatalRemoteException e, String indexUrl,
                                                ResultReporter reporter, RunOptions options) {
        record(reporter, indexUrl, indexUrl == null ? ActionKind.CREATE : ActionKind.UPDATE, ActionOutcome.FAIL,
                e.getMessage());
        return new SyncAbortedException("Reconciliation aborted while writing the index: " + e.getMessage(),
                reporter.build(indexUrl, options.descriptor), e);
    }

    private void record(ResultReporter reporter, String url, ActionKind kind, ActionOutcome outcome, String message) {
        reporter.record(new ActionRecord(INDEX_SEQUENCE, INDEX_PATH, url, kind, outcome, message));
        logger.info("{} index (url={}) -> {}", kind, url, outcome);
        Map<String, Object> details = new HashMap<>();
        details.put("action", kind);
        details.put("url", url);
        details.put("result", outcome);
        runLog.info("Index topic", details);
    }
}
