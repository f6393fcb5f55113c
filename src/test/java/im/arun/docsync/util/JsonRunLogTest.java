package im.arun.docsync.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonRunLogTest {

    @Test
    void shouldKeepEntriesInMemoryWithoutDirectory() {
        JsonRunLog log = new JsonRunLog();

        log.info("started");
        log.error("failed", Map.of("path", "doc"));

        assertThat(log.getLogPath()).isNull();
        assertThat(log.getEntries()).hasSize(2);
        assertThat(log.getEntries().get(1)).containsEntry("level", "ERROR").containsEntry("path", "doc");
    }

    @Test
    void shouldWriteEntriesAsJsonArray(@TempDir Path dir) throws IOException {
        JsonRunLog log = new JsonRunLog(dir.resolve("logs"));

        log.warn("malformed table", Map.of("reason", "bad row"));
        log.flush();

        JsonNode written = new ObjectMapper().readTree(log.getLogPath().toFile());
        assertThat(log.getLogPath().getFileName().toString()).startsWith("docsync_").endsWith(".json");
        assertThat(written.isArray()).isTrue();
        assertThat(written.get(0).path("level").asText()).isEqualTo("WARNING");
        assertThat(written.get(0).path("reason").asText()).isEqualTo("bad row");
    }

    @Test
    void shouldWriteFileOnlyWhenFlushed(@TempDir Path dir) throws IOException {
        // Given
        JsonRunLog log = new JsonRunLog(dir);
        log.info("started");
        log.info("finished");

        // When
        boolean existedBeforeFlush = Files.exists(log.getLogPath());
        log.flush();

        // Then
        assertThat(existedBeforeFlush).isFalse();
        assertThat(new ObjectMapper().readTree(log.getLogPath().toFile())).hasSize(2);
    }
}
