package im.arun.docsync.model;

import lombok.Builder;
import lombok.Value;

/**
 * A planned step of a reconciliation. Produced by the planner, consumed by the executor.
 */
@Value
@Builder(toBuilder = true)
public class SyncAction {
    int sequence;
    ActionKind kind;
    int level;
    String path;
    String title;

    /** Local node, null when the document was removed locally. */
    DocNode node;

    /** Row of the previous navigation table, null for a new document. */
    NavigationEntry priorEntry;

    /** Topic fetched for the prior entry, null when there is none. */
    RemoteTopic remoteTopic;

    /** A row without a topic. Never causes a remote call. */
    boolean group;

    /** Removed locally but left on the server because topic deletion is disabled. */
    boolean unlinkOnly;

    /** Set when the action is already known to fail, e.g. its topic could not be fetched. */
    String failure;
}
