package im.arun.docsync.reconcile;

import im.arun.docsync.model.ActionKind;
import im.arun.docsync.model.DocNode;
import im.arun.docsync.model.NavigationEntry;
import im.arun.docsync.model.RemoteTopic;
import im.arun.docsync.model.SyncAction;
import im.arun.docsync.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the action list of a run from the local tree and the previous navigation table.
 * <p>
 * Pure: no remote calls. Documents are matched by table path, never by title.
 * The returned actions are in document order; entries that vanished locally are placed
 * right after the local document that preceded them in the previous table.
 */
public class ReconciliationPlanner {
    private static final Logger logger = LoggerFactory.getLogger(ReconciliationPlanner.class);

    /**
     * @param root          the scanned documentation tree
     * @param priorEntries  rows of the previous navigation table, possibly empty
     * @param remoteTopics  topics fetched for prior rows, keyed by table path; a prior topic
     *                      row without an entry here no longer exists on the server
     * @param fetchFailures table path to failure message for topics that could not be fetched
     * @param deleteTopics  whether topics of removed documents are deleted or only unlinked
     */
    public List<SyncAction> plan(DocNode root,
                                 List<NavigationEntry> priorEntries,
                                 Map<String, RemoteTopic> remoteTopics,
                                 Map<String, String> fetchFailures,
                                 boolean deleteTopics) {
        List<DocNode> nodes = TreeUtils.flatten(root);
        Set<String> localPaths = nodes.stream().map(DocNode::getTablePath).collect(Collectors.toSet());

        Map<String, NavigationEntry> priorByPath = new LinkedHashMap<>();
        for (NavigationEntry entry : priorEntries) {
            priorByPath.putIfAbsent(entry.getPath(), entry);
        }

        // Removed rows, keyed by the table path of the surviving row they followed
        List<NavigationEntry> leadingOrphans = new ArrayList<>();
        Map<String, List<NavigationEntry>> orphansAfter = new HashMap<>();
        String anchor = null;
        for (NavigationEntry entry : priorByPath.values()) {
            if (localPaths.contains(entry.getPath())) {
                anchor = entry.getPath();
            } else if (anchor == null) {
                leadingOrphans.add(entry);
            } else {
                orphansAfter.computeIfAbsent(anchor, key -> new ArrayList<>()).add(entry);
            }
        }

        List<SyncAction> actions = new ArrayList<>();
        for (NavigationEntry orphan : leadingOrphans) {
            actions.add(planRemoved(actions.size(), orphan, deleteTopics));
        }
        for (DocNode node : nodes) {
            NavigationEntry prior = priorByPath.get(node.getTablePath());
            actions.add(planLocal(actions.size(), node, prior, remoteTopics, fetchFailures, deleteTopics));
            for (NavigationEntry orphan : orphansAfter.getOrDefault(node.getTablePath(), List.of())) {
                actions.add(planRemoved(actions.size(), orphan, deleteTopics));
            }
        }

        if (logger.isDebugEnabled()) {
            Map<ActionKind, Long> counts = actions.stream()
                    .collect(Collectors.groupingBy(SyncAction::getKind, Collectors.counting()));
            logger.debug("Planned {} actions: {}", actions.size(), counts);
        }
        return actions;
    }

    private SyncAction planLocal(int sequence,
                                 DocNode node,
                                 NavigationEntry prior,
                                 Map<String, RemoteTopic> remoteTopics,
                                 Map<String, String> fetchFailures,
                                 boolean deleteTopics) {
        SyncAction.SyncActionBuilder action = SyncAction.builder()
                .sequence(sequence)
                .level(node.getLevel())
                .path(node.getTablePath())
                .title(node.getTitle())
                .node(node)
                .priorEntry(prior);

        if (!node.hasContent()) {
            if (prior != null && prior.hasTopic()) {
                // The folder lost its index.md, its topic goes like a removed document's
                return action.kind(deleteTopics ? ActionKind.DELETE : ActionKind.SKIP)
                        .unlinkOnly(!deleteTopics)
                        .build();
            }
            return action.kind(prior == null ? ActionKind.CREATE : ActionKind.SKIP)
                    .group(true)
                    .build();
        }

        if (prior == null || !prior.hasTopic()) {
            return action.kind(ActionKind.CREATE).build();
        }

        String failure = fetchFailures.get(node.getTablePath());
        if (failure != null) {
            return action.kind(ActionKind.UPDATE).failure(failure).build();
        }

        RemoteTopic remote = remoteTopics.get(node.getTablePath());
        if (remote == null || !remote.isExists()) {
            logger.info("Topic {} of {} no longer exists, it will be created again", prior.getLink(), node.getTablePath());
            return action.kind(ActionKind.CREATE).build();
        }

        action.remoteTopic(remote);
        if (Objects.equals(remote.getFingerprint(), node.getFingerprint())) {
            return action.kind(ActionKind.SKIP).build();
        }
        return action.kind(ActionKind.UPDATE).build();
    }

    private SyncAction planRemoved(int sequence, NavigationEntry orphan, boolean deleteTopics) {
        SyncAction.SyncActionBuilder action = SyncAction.builder()
                .sequence(sequence)
                .level(orphan.getLevel())
                .path(orphan.getPath())
                .title(orphan.getTitle())
                .priorEntry(orphan);

        if (!orphan.hasTopic()) {
            return action.kind(ActionKind.DELETE).group(true).build();
        }
        if (deleteTopics) {
            return action.kind(ActionKind.DELETE).build();
        }
        return action.kind(ActionKind.SKIP).unlinkOnly(true).build();
    }
}
