package im.arun.docsync.reconcile;

import im.arun.docsync.discourse.TopicClient;
import im.arun.docsync.discourse.TopicUrl;
import im.arun.docsync.exception.DiscourseException;
import im.arun.docsync.exception.FatalRemoteException;
import im.arun.docsync.model.ActionKind;
import im.arun.docsync.model.ActionOutcome;
import im.arun.docsync.model.ActionRecord;
import im.arun.docsync.model.NavigationEntry;
import im.arun.docsync.model.RemoteTopic;
import im.arun.docsync.model.SyncAction;
import im.arun.docsync.report.ResultReporter;
import im.arun.docsync.util.JsonRunLog;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Applies planned actions in three phases: CREATE, then UPDATE, then DELETE.
 * <p>
 * Actions of one phase run concurrently on the worker pool and all of them settle
 * before the next phase starts. A failed action is recorded and does not affect the
 * others. A fatal error, or an abort request, stops the run after the current phase;
 * actions of later phases are recorded as failed.
 */
public class ActionExecutor {
    private static final Logger logger = LoggerFactory.getLogger(ActionExecutor.class);

    private static final List<ActionKind> PHASES = List.of(ActionKind.CREATE, ActionKind.UPDATE, ActionKind.DELETE);

    private final TopicClient client;
    private final Executor executor;
    private final ResultReporter reporter;
    private final JsonRunLog runLog;
    private final int categoryId;
    private final boolean dryRun;
    private final boolean deleteTopics;

    public ActionExecutor(TopicClient client,
                          Executor executor,
                          ResultReporter reporter,
                          JsonRunLog runLog,
                          int categoryId,
                          boolean dryRun,
                          boolean deleteTopics) {
        this.client = client;
        this.executor = executor;
        this.reporter = reporter;
        this.runLog = runLog;
        this.categoryId = categoryId;
        this.dryRun = dryRun;
        this.deleteTopics = deleteTopics;
    }

    /**
     * Outcome of applying a plan.
     */
    @Getter
    public static class ExecutionResult {
        private final FatalRemoteException fatal;
        private final boolean aborted;

        ExecutionResult(FatalRemoteException fatal, boolean aborted) {
            this.fatal = fatal;
            this.aborted = aborted;
        }

        public boolean isComplete() {
            return fatal == null && !aborted;
        }
    }

    public ExecutionResult apply(List<SyncAction> actions, BooleanSupplier abortRequested) {
        List<SyncAction> remote = new ArrayList<>();
        for (SyncAction action : actions) {
            if (needsRemoteCall(action)) {
                remote.add(action);
            } else {
                record(action, recordWithoutRemoteCall(action));
            }
        }

        Map<ActionKind, List<SyncAction>> phases = new LinkedHashMap<>();
        for (ActionKind phase : PHASES) {
            phases.put(phase, remote.stream().filter(action -> action.getKind() == phase).collect(Collectors.toList()));
        }

        AtomicReference<FatalRemoteException> fatal = new AtomicReference<>();
        for (Map.Entry<ActionKind, List<SyncAction>> phase : phases.entrySet()) {
            if (fatal.get() != null || abortRequested.getAsBoolean()) {
                String reason = fatal.get() != null
                        ? "not attempted after fatal error: " + fatal.get().getMessage()
                        : "not attempted, run aborted";
                phase.getValue().forEach(action -> record(action, failed(action, urlOf(action), reason)));
                continue;
            }
            runPhase(phase.getKey(), phase.getValue(), fatal);
        }

        boolean aborted = fatal.get() == null && abortRequested.getAsBoolean();
        return new ExecutionResult(fatal.get(), aborted);
    }

    private void runPhase(ActionKind phase, List<SyncAction> actions, AtomicReference<FatalRemoteException> fatal) {
        if (actions.isEmpty()) {
            return;
        }
        logger.info("{} phase: {} topic(s)", phase, actions.size());

        List<CompletableFuture<Void>> futures = actions.stream()
                .map(action -> CompletableFuture.runAsync(() -> record(action, applyOne(action, fatal)), executor))
                .collect(Collectors.toList());

        // Barrier: every action of this phase settles before the next phase
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }

    private ActionRecord applyOne(SyncAction action, AtomicReference<FatalRemoteException> fatal) {
        try {
            switch (action.getKind()) {
                case CREATE:
                    RemoteTopic created = client.createTopic(categoryId, action.getTitle(), action.getNode().getContent());
                    return success(action, created.getUrl());
                case UPDATE:
                    long updateId = topicId(action);
                    RemoteTopic updated = client.updateTopic(updateId, action.getNode().getContent());
                    return success(action, updated.getUrl());
                case DELETE:
                    long deleteId = topicId(action);
                    if (!client.deleteTopic(deleteId)) {
                        logger.info("Topic of {} was already deleted", action.getPath());
                    }
                    return success(action, urlOf(action));
                default:
                    throw new IllegalStateException("No remote call for " + action.getKind());
            }
        } catch (FatalRemoteException e) {
            fatal.compareAndSet(null, e);
            logger.error("Fatal error applying {} for {}: {}", action.getKind(), action.getPath(), e.getMessage());
            return failed(action, urlOf(action), e.getMessage());
        } catch (DiscourseException e) {
            logger.error("Failed to apply {} for {}: {}", action.getKind(), action.getPath(), e.getMessage());
            return failed(action, urlOf(action), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error applying {} for {}", action.getKind(), action.getPath(), e);
            return failed(action, urlOf(action), e.toString());
        }
    }

    private boolean needsRemoteCall(SyncAction action) {
        return !dryRun
                && action.getFailure() == null
                && !action.isGroup()
                && action.getKind().isMutating();
    }

    private ActionRecord recordWithoutRemoteCall(SyncAction action) {
        if (action.getFailure() != null) {
            return failed(action, urlOf(action), action.getFailure());
        }
        String url = action.isGroup() ? null : urlOf(action);
        if (action.getKind() == ActionKind.CREATE && !action.isGroup()) {
            url = NavigationEntry.NOT_CREATED_LINK;
        }
        if (action.isUnlinkOnly()) {
            return new ActionRecord(action.getSequence(), action.getPath(), url, action.getKind(), ActionOutcome.SKIP,
                    "removed locally, topic left in place and unlinked from the index");
        }
        if (action.getKind().isMutating() && dryRun) {
            return new ActionRecord(action.getSequence(), action.getPath(), url, action.getKind(), ActionOutcome.SKIP,
                    "dry run");
        }
        return new ActionRecord(action.getSequence(), action.getPath(), url, action.getKind(), ActionOutcome.SUCCESS);
    }

    private ActionRecord success(SyncAction action, String url) {
        return new ActionRecord(action.getSequence(), action.getPath(), url, action.getKind(), ActionOutcome.SUCCESS);
    }

    private ActionRecord failed(SyncAction action, String url, String message) {
        return new ActionRecord(action.getSequence(), action.getPath(), url, action.getKind(), ActionOutcome.FAIL, message);
    }

    private long topicId(SyncAction action) {
        if (action.getRemoteTopic() != null) {
            return action.getRemoteTopic().getTopicId();
        }
        return TopicUrl.parse(client.getBaseUrl(), urlOf(action)).getTopicId();
    }

    /**
     * Absolute URL of the topic the action works on, null when it has none yet.
     */
    private String urlOf(SyncAction action) {
        if (action.getRemoteTopic() != null) {
            return action.getRemoteTopic().getUrl();
        }
        NavigationEntry prior = action.getPriorEntry();
        if (prior != null && prior.hasTopic() && action.getKind() != ActionKind.CREATE) {
            return TopicUrl.absolute(client.getBaseUrl(), prior.getLink());
        }
        return null;
    }

    private void record(SyncAction action, ActionRecord record) {
        reporter.record(record);
        logger.info("{} {} (level {}, url={}) -> {}, dry run: {}, delete topics: {}",
                action.getKind(), action.getPath(), action.getLevel(), record.getUrl(), record.getOutcome(),
                dryRun, deleteTopics);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", record.getKind());
        details.put("path", record.getPath());
        details.put("url", record.getUrl());
        details.put("result", record.getOutcome());
        if (record.getMessage() != null) {
            details.put("message", record.getMessage());
        }
        if (record.getOutcome() == ActionOutcome.FAIL) {
            runLog.error("Action failed", details);
        } else {
            runLog.info("Action applied", details);
        }
    }
}
