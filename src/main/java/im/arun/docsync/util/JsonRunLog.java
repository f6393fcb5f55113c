package im.arun.docsync.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates structured events of a run and writes them to a JSON file on {@link #flush()}.
 * Without a log directory the events are only kept in memory.
 */
public class JsonRunLog {
    private static final Logger systemLogger = LoggerFactory.getLogger(JsonRunLog.class);
    private final Path logPath;
    private final List<Map<String, Object>> logData = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public JsonRunLog() {
        this(null);
    }

    public JsonRunLog(Path logDirectory) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        if (logDirectory == null) {
            this.logPath = null;
            return;
        }

        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        try {
            Files.createDirectories(logDirectory);
        } catch (IOException e) {
            systemLogger.error("Failed to create log directory {}", logDirectory, e);
        }
        this.logPath = logDirectory.resolve(String.format("docsync_%s.json", timestamp));
    }

    public void info(String message) {
        info(message, Map.of());
    }

    public void info(String message, Map<String, ?> details) {
        log("INFO", message, details);
    }

    public void warn(String message, Map<String, ?> details) {
        log("WARNING", message, details);
    }

    public void error(String message, Map<String, ?> details) {
        log("ERROR", message, details);
    }

    private synchronized void log(String level, String message, Map<String, ?> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level);
        entry.put("message", message);
        entry.putAll(details);
        logData.add(entry);
    }

    /**
     * Write all events recorded so far. Called once when the run ends.
     */
    public void flush() {
        if (logPath == null) {
            return;
        }
        List<Map<String, Object>> snapshot = getEntries();
        try {
            objectMapper.writeValue(logPath.toFile(), snapshot);
        } catch (IOException e) {
            systemLogger.error("Failed to write log file: {}", logPath, e);
        }
    }

    public synchronized List<Map<String, Object>> getEntries() {
        return List.copyOf(logData);
    }

    public Path getLogPath() {
        return logPath;
    }
}
