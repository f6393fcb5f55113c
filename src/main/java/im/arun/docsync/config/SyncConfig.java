package im.arun.docsync.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class SyncConfig {
    private String discourseHost;
    private String apiUsername;
    private String apiKey;
    private int categoryId = 41;
    private boolean deleteTopics = true;
    private boolean dryRun = false;
    private String docsPath = "docs";
    private String indexUrl;
    private String documentationName;
    private int maxRetries = 3;
    private long baseBackoffMs = 1000;
    private long maxBackoffMs = 30000;
    private int connectTimeoutSeconds = 30;
    private int readTimeoutSeconds = 60;
    private int maxConcurrency = 4;
    private List<String> tags = new ArrayList<>(List.of("docs"));

    public String getBaseUrl() {
        return "https://" + discourseHost;
    }
}
