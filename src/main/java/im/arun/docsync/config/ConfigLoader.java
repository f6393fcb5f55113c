package im.arun.docsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.docsync.exception.InputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds the {@link SyncConfig} for a run: defaults from {@code docsync.yaml}, overlaid
 * with user options, credentials falling back to the environment, then validated.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG_RESOURCE = "docsync.yaml";
    public static final String API_USERNAME_ENV = "DISCOURSE_API_USERNAME";
    public static final String API_KEY_ENV = "DISCOURSE_API_KEY";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final SyncConfig defaultConfig;
    private final Function<String, String> environment;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this(configPath, System::getenv);
    }

    public ConfigLoader(String configPath, Function<String, String> environment) {
        this.environment = environment;
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private SyncConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), SyncConfig.class);
                }
                throw new InputException("Configuration file not found: " + configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, SyncConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_CONFIG_RESOURCE);
            return new SyncConfig();
        } catch (IOException e) {
            throw new InputException("Failed to load configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Merge user options into a copy of the defaults and validate the result.
     *
     * @param userOptions option name (camelCase or snake_case) to value, may be null
     * @throws InputException if a value is invalid or a required value is missing
     */
    public SyncConfig load(Map<String, Object> userOptions) {
        SyncConfig config = copyConfig(defaultConfig);

        if (userOptions != null) {
            userOptions.forEach((key, value) -> {
                if (value != null) {
                    apply(config, key, value);
                }
            });
        }

        if (isBlank(config.getApiUsername())) {
            config.setApiUsername(environment.apply(API_USERNAME_ENV));
        }
        if (isBlank(config.getApiKey())) {
            config.setApiKey(environment.apply(API_KEY_ENV));
        }

        validate(config);
        return config;
    }

    private void apply(SyncConfig config, String key, Object value) {
        switch (key) {
            case "discourseHost":
            case "discourse_host":
                config.setDiscourseHost(String.valueOf(value));
                break;
            case "apiUsername":
            case "discourse_api_username":
                config.setApiUsername(String.valueOf(value));
                break;
            case "apiKey":
            case "discourse_api_key":
                config.setApiKey(String.valueOf(value));
                break;
            case "categoryId":
            case "discourse_category_id":
                config.setCategoryId(parseInt(key, value));
                break;
            case "deleteTopics":
            case "delete_topics":
                config.setDeleteTopics(parseBoolean(key, value));
                break;
            case "dryRun":
            case "dry_run":
                config.setDryRun(parseBoolean(key, value));
                break;
            case "docsPath":
            case "docs_path":
                config.setDocsPath(String.valueOf(value));
                break;
            case "indexUrl":
            case "index_url":
                config.setIndexUrl(String.valueOf(value));
                break;
            case "documentationName":
            case "documentation_name":
                config.setDocumentationName(String.valueOf(value));
                break;
            case "maxRetries":
            case "max_retries":
                config.setMaxRetries(parseInt(key, value));
                break;
            case "maxConcurrency":
            case "max_concurrency":
                config.setMaxConcurrency(parseInt(key, value));
                break;
            default:
                logger.warn("Unknown configuration key: {}", key);
        }
    }

    /**
     * @throws InputException describing the first invalid value
     */
    public static void validate(SyncConfig config) {
        String host = config.getDiscourseHost();
        if (isBlank(host)) {
            throw new InputException("Invalid discourse_host input, it must be non-empty, got '" + host + "'");
        }
        host = host.trim().toLowerCase(Locale.ROOT);
        if (host.startsWith("http://") || host.startsWith("https://")) {
            throw new InputException(
                    "Invalid discourse_host input, it should not include the protocol, got '" + host + "'");
        }
        config.setDiscourseHost(host.replaceAll("/+$", ""));

        if (isBlank(config.getApiUsername())) {
            throw new InputException("The " + API_USERNAME_ENV
                    + " is missing but is required to be able to interact with the documentation server");
        }
        if (isBlank(config.getApiKey())) {
            throw new InputException("The " + API_KEY_ENV
                    + " is missing but is required to be able to interact with the documentation server");
        }
        if (config.getCategoryId() <= 0) {
            throw new InputException(
                    "Invalid discourse_category_id input, it must be a positive integer, got " + config.getCategoryId());
        }
        if (config.getMaxRetries() < 1) {
            throw new InputException("max_retries must be at least 1, got " + config.getMaxRetries());
        }
        if (config.getMaxConcurrency() < 1) {
            throw new InputException("max_concurrency must be at least 1, got " + config.getMaxConcurrency());
        }
        if (isBlank(config.getDocsPath())) {
            throw new InputException("docs_path must not be empty");
        }
        if (config.getBaseBackoffMs() < 0) {
            throw new InputException("base_backoff_ms must not be negative, got " + config.getBaseBackoffMs());
        }
        if (config.getMaxBackoffMs() < config.getBaseBackoffMs()) {
            throw new InputException(String.format("max_backoff_ms must be at least base_backoff_ms (%d), got %d",
                    config.getBaseBackoffMs(), config.getMaxBackoffMs()));
        }
        if (config.getConnectTimeoutSeconds() < 1) {
            throw new InputException(
                    "connect_timeout_seconds must be at least 1, got " + config.getConnectTimeoutSeconds());
        }
        if (config.getReadTimeoutSeconds() < 1) {
            throw new InputException("read_timeout_seconds must be at least 1, got " + config.getReadTimeoutSeconds());
        }
    }

    private int parseInt(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new InputException("Invalid " + key + " input, it must be an integer, got '" + value + "'");
        }
    }

    private boolean parseBoolean(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = String.valueOf(value).trim();
        if ("yes".equalsIgnoreCase(text) || "true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("no".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new InputException("Invalid " + key + " input, it must be a boolean, got '" + value + "'");
    }

    private SyncConfig copyConfig(SyncConfig source) {
        SyncConfig copy = new SyncConfig();
        copy.setDiscourseHost(source.getDiscourseHost());
        copy.setApiUsername(source.getApiUsername());
        copy.setApiKey(source.getApiKey());
        copy.setCategoryId(source.getCategoryId());
        copy.setDeleteTopics(source.isDeleteTopics());
        copy.setDryRun(source.isDryRun());
        copy.setDocsPath(source.getDocsPath());
        copy.setIndexUrl(source.getIndexUrl());
        copy.setDocumentationName(source.getDocumentationName());
        copy.setMaxRetries(source.getMaxRetries());
        copy.setBaseBackoffMs(source.getBaseBackoffMs());
        copy.setMaxBackoffMs(source.getMaxBackoffMs());
        copy.setConnectTimeoutSeconds(source.getConnectTimeoutSeconds());
        copy.setReadTimeoutSeconds(source.getReadTimeoutSeconds());
        copy.setMaxConcurrency(source.getMaxConcurrency());
        copy.setTags(source.getTags() == null ? new ArrayList<>() : new ArrayList<>(source.getTags()));
        return copy;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
