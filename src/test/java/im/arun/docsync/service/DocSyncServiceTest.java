package im.arun.docsync.service;

import im.arun.docsync.config.SyncConfig;
import im.arun.docsync.discourse.InMemoryTopicClient;
import im.arun.docsync.discourse.TopicClient;
import im.arun.docsync.exception.AuthenticationException;
import im.arun.docsync.exception.InputException;
import im.arun.docsync.model.ActionKind;
import im.arun.docsync.model.MigrationReport;
import im.arun.docsync.model.SyncReport;
import im.arun.docsync.util.JsonRunLog;
import im.arun.docsync.util.TreeUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocSyncServiceTest {

    private static final Executor DIRECT = Runnable::run;

    @TempDir
    Path project;

    @Mock
    TopicClient mockClient;

    private SyncConfig config;
    private Path docs;

    @BeforeEach
    void setUp() throws IOException {
        config = new SyncConfig();
        config.setDiscourseHost("discourse.example.com");
        config.setApiUsername("docs-bot");
        config.setApiKey("secret");

        docs = project.resolve("docs");
        Files.createDirectories(docs);
        Files.writeString(docs.resolve("doc.md"), "# Doc\n");
    }

    @Test
    void shouldStopBeforeAnyChangeWhenCredentialsAreRejected() {
        // Given
        doThrow(new AuthenticationException("HTTP 401")).when(mockClient).checkAccess();
        DocSyncService service = new DocSyncService(config, mockClient, DIRECT, new JsonRunLog());

        // When / Then
        assertThatThrownBy(() -> service.run(docs, null)).isInstanceOf(AuthenticationException.class);
        verify(mockClient, never()).createTopic(anyInt(), anyString(), anyString());
        verify(mockClient, never()).fetchTopic(anyString());
    }

    @Test
    void shouldRejectConfiguredIndexThatDoesNotExist() {
        when(mockClient.getBaseUrl()).thenReturn(InMemoryTopicClient.BASE_URL);
        when(mockClient.fetchTopic(InMemoryTopicClient.BASE_URL + "/t/gone/9")).thenReturn(Optional.empty());
        config.setIndexUrl("/t/gone/9");
        DocSyncService service = new DocSyncService(config, mockClient, DIRECT, new JsonRunLog());

        assertThatThrownBy(() -> service.run(docs, null))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("/t/gone/9");
        verify(mockClient, never()).createTopic(anyInt(), anyString(), anyString());
    }

    @Test
    void shouldRejectMalformedIndexUrl() {
        when(mockClient.getBaseUrl()).thenReturn(InMemoryTopicClient.BASE_URL);
        config.setIndexUrl("https://elsewhere.example.com/t/index/1");
        DocSyncService service = new DocSyncService(config, mockClient, DIRECT, new JsonRunLog());

        assertThatThrownBy(() -> service.run(docs, null))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("index_url");
    }

    @Test
    void shouldNameIndexAfterMetadata() throws IOException {
        // Given
        InMemoryTopicClient forum = new InMemoryTopicClient();
        Path metadata = project.resolve("metadata.yaml");
        Files.writeString(metadata, "name: my-charm\n");
        DocSyncService service = new DocSyncService(config, forum, DIRECT, new JsonRunLog());

        // When
        SyncReport report = service.run(docs, metadata);

        // Then
        assertThat(forum.getMutations()).contains("create My Charm Documentation Overview");
        assertThat(report.getIndexUrl()).contains("/t/my-charm-documentation-overview/");
    }

    @Test
    void shouldUseIndexFromMetadataOnLaterRuns() throws IOException {
        InMemoryTopicClient forum = new InMemoryTopicClient();
        DocSyncService first = new DocSyncService(config, forum, DIRECT, new JsonRunLog());
        SyncReport created = first.run(docs, null);
        Path metadata = project.resolve("metadata.yaml");
        Files.writeString(metadata, "name: project\ndocs: " + created.getIndexUrl() + "\n");

        SyncReport second = new DocSyncService(config, forum, DIRECT, new JsonRunLog()).run(docs, metadata);

        assertThat(second.getIndexUrl()).isEqualTo(created.getIndexUrl());
        assertThat(second.getUrlsWithActions().values())
                .allSatisfy(result -> assertThat(result.getAction()).isEqualTo(ActionKind.SKIP));
    }

    @Test
    void shouldFallBackToProjectFolderName() {
        InMemoryTopicClient forum = new InMemoryTopicClient();
        config.setDocumentationName(null);

        new DocSyncService(config, forum, DIRECT, new JsonRunLog()).run(docs, null);

        String expectedTitle = "create " + TreeUtils.titleFromName(project.getFileName().toString())
                + DocSyncService.INDEX_TITLE_SUFFIX;
        assertThat(forum.getMutations()).contains(expectedTitle);
    }

    @Test
    void shouldMigrateIntoMissingDocsDirectory() throws IOException {
        // Given
        InMemoryTopicClient forum = new InMemoryTopicClient();
        SyncReport created = new DocSyncService(config, forum, DIRECT, new JsonRunLog()).run(docs, null);
        Path metadata = project.resolve("metadata.yaml");
        Files.writeString(metadata, "name: project\ndocs: " + created.getIndexUrl() + "\n");
        Path fresh = project.resolve("migrated");
        DocSyncService service = new DocSyncService(config, forum, DIRECT, new JsonRunLog());

        // When
        boolean required = service.requiresMigration(fresh, metadata);
        MigrationReport report = service.migrate(fresh, metadata);

        // Then
        assertThat(required).isTrue();
        assertThat(Files.readString(fresh.resolve("doc.md"))).isEqualTo("# Doc\n");
        assertThat(report.getIndexUrl()).isEqualTo(created.getIndexUrl());
        assertThat(service.requiresMigration(fresh, metadata)).isFalse();
    }

    @Test
    void shouldNotMigrateWithoutIndexTopic() {
        DocSyncService service = new DocSyncService(config, new InMemoryTopicClient(), DIRECT, new JsonRunLog());
        Path missing = project.resolve("missing");

        assertThat(service.requiresMigration(missing, null)).isFalse();
        assertThatThrownBy(() -> service.migrate(missing, null))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("nothing to migrate");
    }

    @Test
    void shouldNotMigrateOverExistingDirectory() {
        config.setIndexUrl("/t/index/1");
        DocSyncService service = new DocSyncService(config, new InMemoryTopicClient(), DIRECT, new JsonRunLog());

        assertThat(service.requiresMigration(docs, null)).isFalse();
        assertThatThrownBy(() -> service.migrate(docs, null))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("already exists");
    }
}
