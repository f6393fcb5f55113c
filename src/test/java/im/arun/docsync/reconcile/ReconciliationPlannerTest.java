package im.arun.docsync.reconcile;

import im.arun.docsync.model.ActionKind;
import im.arun.docsync.model.DocNode;
import im.arun.docsync.model.NavigationEntry;
import im.arun.docsync.model.RemoteTopic;
import im.arun.docsync.model.SyncAction;
import im.arun.docsync.scan.ContentFingerprint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationPlannerTest {

    private final ReconciliationPlanner planner = new ReconciliationPlanner();

    private static DocNode root() {
        DocNode root = new DocNode();
        root.setRelativePath(Path.of(""));
        root.setTablePath("index");
        root.setDirectory(true);
        return root;
    }

    private static DocNode doc(DocNode parent, String tablePath, String content) {
        DocNode node = new DocNode();
        node.setRelativePath(Path.of(tablePath + ".md"));
        node.setTablePath(tablePath);
        node.setTitle(tablePath.toUpperCase());
        node.setContent(content);
        node.setFingerprint(ContentFingerprint.of(content));
        parent.addChild(node);
        return node;
    }

    private static DocNode folder(DocNode parent, String tablePath) {
        DocNode node = new DocNode();
        node.setRelativePath(Path.of(tablePath));
        node.setTablePath(tablePath);
        node.setTitle(tablePath.toUpperCase());
        node.setDirectory(true);
        parent.addChild(node);
        return node;
    }

    private static NavigationEntry row(int level, String path, long id) {
        return new NavigationEntry(level, path, path.toUpperCase(), "/t/" + path + "/" + id);
    }

    private static RemoteTopic remote(String path, long id, String body) {
        return RemoteTopic.builder()
                .topicId(id)
                .url("https://discourse.example.com/t/" + path + "/" + id)
                .body(body)
                .fingerprint(ContentFingerprint.of(body))
                .build();
    }

    @Nested
    @DisplayName("Local documents")
    class LocalDocuments {

        @Test
        void shouldCreateEverythingWithoutPriorTable() {
            // Given
            DocNode root = root();
            doc(root, "a", "# A");
            DocNode group = folder(root, "g");
            doc(group, "g-b", "# B");

            // When
            List<SyncAction> actions = planner.plan(root, List.of(), Map.of(), Map.of(), true);

            // Then
            assertThat(actions).extracting(SyncAction::getPath).containsExactly("a", "g", "g-b");
            assertThat(actions).extracting(SyncAction::getKind).containsOnly(ActionKind.CREATE);
            assertThat(actions.get(1).isGroup()).isTrue();
            assertThat(actions).extracting(SyncAction::getLevel).containsExactly(1, 1, 2);
            assertThat(actions).extracting(SyncAction::getSequence).containsExactly(0, 1, 2);
        }

        @Test
        void shouldSkipUnchangedAndUpdateChanged() {
            DocNode root = root();
            doc(root, "same", "# Same\n\ntext");
            doc(root, "changed", "# Changed\n\nnew text");

            List<SyncAction> actions = planner.plan(root,
                    List.of(row(1, "same", 1), row(1, "changed", 2)),
                    Map.of("same", remote("same", 1, "# Same\ntext\n"),
                            "changed", remote("changed", 2, "# Changed\n\nold text")),
                    Map.of(), true);

            assertThat(actions).extracting(SyncAction::getKind).containsExactly(ActionKind.SKIP, ActionKind.UPDATE);
            assertThat(actions.get(1).getRemoteTopic().getTopicId()).isEqualTo(2L);
        }

        @Test
        void shouldRecreateTopicMissingOnServer() {
            DocNode root = root();
            doc(root, "a", "# A");

            List<SyncAction> actions = planner.plan(root, List.of(row(1, "a", 1)), Map.of(), Map.of(), true);

            assertThat(actions.get(0).getKind()).isEqualTo(ActionKind.CREATE);
        }

        @Test
        void shouldCarryFetchFailure() {
            DocNode root = root();
            doc(root, "a", "# A");

            List<SyncAction> actions = planner.plan(root, List.of(row(1, "a", 1)), Map.of(),
                    Map.of("a", "HTTP 500"), true);

            assertThat(actions.get(0).getKind()).isEqualTo(ActionKind.UPDATE);
            assertThat(actions.get(0).getFailure()).isEqualTo("HTTP 500");
        }

        @Test
        void shouldKeepExistingGroupRow() {
            DocNode root = root();
            folder(root, "g");

            List<SyncAction> actions = planner.plan(root,
                    List.of(NavigationEntry.group(1, "g", "G")), Map.of(), Map.of(), true);

            assertThat(actions.get(0).getKind()).isEqualTo(ActionKind.SKIP);
            assertThat(actions.get(0).isGroup()).isTrue();
        }

        @Test
        void shouldDeleteTopicOfFolderThatLostItsIndex() {
            DocNode root = root();
            folder(root, "g");

            List<SyncAction> actions = planner.plan(root, List.of(row(1, "g", 5)), Map.of(), Map.of(), true);

            assertThat(actions.get(0).getKind()).isEqualTo(ActionKind.DELETE);
            assertThat(actions.get(0).getNode()).isNotNull();
        }
    }

    @Nested
    @DisplayName("Removed documents")
    class RemovedDocuments {

        @Test
        void shouldPlaceRemovedRowAtItsPriorPosition() {
            // Given
            DocNode root = root();
            doc(root, "a", "# A");
            doc(root, "c", "# C");
            List<NavigationEntry> prior = List.of(row(1, "a", 1), row(1, "b", 2), row(1, "c", 3));

            // When
            List<SyncAction> actions = planner.plan(root, prior,
                    Map.of("a", remote("a", 1, "# A"), "c", remote("c", 3, "# C")), Map.of(), true);

            // Then
            assertThat(actions).extracting(SyncAction::getPath).containsExactly("a", "b", "c");
            assertThat(actions.get(1).getKind()).isEqualTo(ActionKind.DELETE);
            assertThat(actions.get(1).getNode()).isNull();
        }

        @Test
        void shouldPlaceLeadingRemovedRowsFirst() {
            DocNode root = root();
            doc(root, "b", "# B");

            List<SyncAction> actions = planner.plan(root, List.of(row(1, "a", 1), row(1, "b", 2)),
                    Map.of("b", remote("b", 2, "# B")), Map.of(), true);

            assertThat(actions).extracting(SyncAction::getPath).containsExactly("a", "b");
        }

        @Test
        void shouldOnlyUnlinkWhenDeletionDisabled() {
            DocNode root = root();

            List<SyncAction> actions = planner.plan(root, List.of(row(1, "a", 1)), Map.of(), Map.of(), false);

            assertThat(actions.get(0).getKind()).isEqualTo(ActionKind.SKIP);
            assertThat(actions.get(0).isUnlinkOnly()).isTrue();
        }

        @Test
        void shouldDropRemovedGroupRowWithoutRemoteCall() {
            DocNode root = root();

            List<SyncAction> actions = planner.plan(root,
                    List.of(NavigationEntry.group(1, "g", "G")), Map.of(), Map.of(), true);

            assertThat(actions.get(0).getKind()).isEqualTo(ActionKind.DELETE);
            assertThat(actions.get(0).isGroup()).isTrue();
        }
    }

    @Test
    void shouldMatchByPathNotTitle() {
        DocNode root = root();
        DocNode node = doc(root, "a", "# A");
        node.setTitle("Renamed");

        List<SyncAction> actions = planner.plan(root, List.of(row(1, "a", 1)),
                Map.of("a", remote("a", 1, "# A")), Map.of(), true);

        assertThat(actions.get(0).getKind()).isEqualTo(ActionKind.SKIP);
        assertThat(actions.get(0).getTitle()).isEqualTo("Renamed");
    }
}
