package im.arun.docsync.config;

import im.arun.docsync.exception.InputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static final Map<String, String> ENV = Map.of(
            ConfigLoader.API_USERNAME_ENV, "env-user",
            ConfigLoader.API_KEY_ENV, "env-key");

    private final ConfigLoader loader = new ConfigLoader(null, ENV::get);

    private static Map<String, Object> options(Object... keyValues) {
        Map<String, Object> options = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            options.put((String) keyValues[i], keyValues[i + 1]);
        }
        return options;
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        void shouldLoadBundledDefaults() {
            SyncConfig config = loader.load(options("discourseHost", "discourse.example.com"));

            assertThat(config.getCategoryId()).isEqualTo(41);
            assertThat(config.isDeleteTopics()).isTrue();
            assertThat(config.isDryRun()).isFalse();
            assertThat(config.getDocsPath()).isEqualTo("docs");
            assertThat(config.getMaxRetries()).isEqualTo(3);
            assertThat(config.getTags()).containsExactly("docs");
        }

        @Test
        void shouldTakeCredentialsFromEnvironment() {
            SyncConfig config = loader.load(options("discourse_host", "discourse.example.com"));

            assertThat(config.getApiUsername()).isEqualTo("env-user");
            assertThat(config.getApiKey()).isEqualTo("env-key");
        }

        @Test
        void shouldPreferExplicitCredentials() {
            SyncConfig config = loader.load(options(
                    "discourseHost", "discourse.example.com",
                    "apiUsername", "cli-user",
                    "apiKey", "cli-key"));

            assertThat(config.getApiUsername()).isEqualTo("cli-user");
            assertThat(config.getApiKey()).isEqualTo("cli-key");
        }

        @Test
        void shouldReadExplicitConfigFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("custom.yaml");
            Files.writeString(file, "categoryId: 7\ndeleteTopics: false\ndiscourseHost: forum.example.org\n");

            SyncConfig config = new ConfigLoader(file.toString(), ENV::get).load(null);

            assertThat(config.getCategoryId()).isEqualTo(7);
            assertThat(config.isDeleteTopics()).isFalse();
            assertThat(config.getDiscourseHost()).isEqualTo("forum.example.org");
        }

        @Test
        void shouldRejectMissingConfigFile(@TempDir Path dir) {
            assertThatThrownBy(() -> new ConfigLoader(dir.resolve("missing.yaml").toString(), ENV::get))
                    .isInstanceOf(InputException.class);
        }
    }

    @Nested
    @DisplayName("Option parsing")
    class OptionParsing {

        @Test
        void shouldParseStringValues() {
            SyncConfig config = loader.load(options(
                    "discourseHost", "discourse.example.com",
                    "discourse_category_id", "12",
                    "delete_topics", "false",
                    "dry_run", "true"));

            assertThat(config.getCategoryId()).isEqualTo(12);
            assertThat(config.isDeleteTopics()).isFalse();
            assertThat(config.isDryRun()).isTrue();
        }

        @Test
        void shouldNormalizeHost() {
            SyncConfig config = loader.load(options("discourseHost", " Discourse.Example.com/ "));

            assertThat(config.getDiscourseHost()).isEqualTo("discourse.example.com");
            assertThat(config.getBaseUrl()).isEqualTo("https://discourse.example.com");
        }

        @Test
        void shouldRejectNonNumericCategory() {
            assertThatThrownBy(() -> loader.load(options(
                    "discourseHost", "discourse.example.com", "categoryId", "docs")))
                    .isInstanceOf(InputException.class)
                    .hasMessageContaining("integer");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void shouldRejectMissingHost() {
            assertThatThrownBy(() -> loader.load(options()))
                    .isInstanceOf(InputException.class)
                    .hasMessageContaining("discourse_host");
        }

        @Test
        void shouldRejectHostWithProtocol() {
            assertThatThrownBy(() -> loader.load(options("discourseHost", "https://discourse.example.com")))
                    .isInstanceOf(InputException.class)
                    .hasMessageContaining("protocol");
        }

        @Test
        void shouldRejectMissingCredentials() {
            ConfigLoader withoutEnv = new ConfigLoader(null, name -> null);

            assertThatThrownBy(() -> withoutEnv.load(options("discourseHost", "discourse.example.com")))
                    .isInstanceOf(InputException.class)
                    .hasMessageContaining(ConfigLoader.API_USERNAME_ENV);
        }

        @Test
        void shouldRejectNonPositiveCategory() {
            assertThatThrownBy(() -> loader.load(options("discourseHost", "discourse.example.com", "categoryId", 0)))
                    .isInstanceOf(InputException.class)
                    .hasMessageContaining("positive");
        }

        @Test
        void shouldRejectBackoffCapBelowBase(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("custom.yaml");
            Files.writeString(file, "discourseHost: forum.example.org\nbaseBackoffMs: 5000\nmaxBackoffMs: 100\n");

            assertThatThrownBy(() -> new ConfigLoader(file.toString(), ENV::get).load(null))
                    .isInstanceOf(InputException.class)
                    .hasMessageContaining("max_backoff_ms");
        }

        @Test
        void shouldRejectNonPositiveTimeout(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("custom.yaml");
            Files.writeString(file, "discourseHost: forum.example.org\nreadTimeoutSeconds: 0\n");

            assertThatThrownBy(() -> new ConfigLoader(file.toString(), ENV::get).load(null))
                    .isInstanceOf(InputException.class)
                    .hasMessageContaining("read_timeout_seconds");
        }
    }
}
