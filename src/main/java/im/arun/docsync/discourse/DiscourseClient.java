package im.arun.docsync.discourse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.docsync.config.SyncConfig;
import im.arun.docsync.exception.AuthenticationException;
import im.arun.docsync.exception.DiscourseException;
import im.arun.docsync.exception.InputException;
import im.arun.docsync.exception.PermissionDeniedException;
import im.arun.docsync.exception.TopicNotFoundException;
import im.arun.docsync.model.RemoteTopic;
import im.arun.docsync.scan.ContentFingerprint;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Discourse API client with retry logic.
 * Authenticates with the {@code Api-Key} and {@code Api-Username} headers.
 */
public class DiscourseClient implements TopicClient {
    private static final Logger logger = LoggerFactory.getLogger(DiscourseClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String EDIT_REASON = "Documentation updated";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiUsername;
    private final String apiKey;
    private final int categoryId;
    private final List<String> tags;
    private final RetryPolicy retryPolicy;
    private final RetryingCall.Sleeper sleeper;

    public DiscourseClient(SyncConfig config) {
        this(config, new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(config.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .callTimeout(config.getReadTimeoutSeconds() * 2L, TimeUnit.SECONDS)
                .connectionPool(new ConnectionPool(config.getMaxConcurrency(), 5, TimeUnit.MINUTES))
                .build(), Thread::sleep);
    }

    DiscourseClient(SyncConfig config, OkHttpClient httpClient, RetryingCall.Sleeper sleeper) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.baseUrl = config.getBaseUrl();
        this.apiUsername = config.getApiUsername();
        this.apiKey = config.getApiKey();
        this.categoryId = config.getCategoryId();
        this.tags = List.copyOf(config.getTags());
        this.retryPolicy = new RetryPolicy(config.getMaxRetries(), config.getBaseBackoffMs(), config.getMaxBackoffMs());
        this.sleeper = sleeper;
    }

    @Override
    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public void checkAccess() {
        try {
            JsonNode category = execute("Check category " + categoryId,
                    get("/c/" + categoryId + "/show.json"));
            logger.info("Connected to {} as {}, category {} ({})", baseUrl, apiUsername, categoryId,
                    category.path("category").path("name").asText("unknown"));
        } catch (TopicNotFoundException e) {
            throw new InputException("Discourse category " + categoryId + " not found on " + baseUrl, e);
        } catch (PermissionDeniedException e) {
            throw new AuthenticationException("User " + apiUsername + " may not access category " + categoryId
                    + " on " + baseUrl + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<RemoteTopic> fetchTopic(String url) {
        TopicUrl topicUrl = TopicUrl.parse(baseUrl, url);
        JsonNode topic;
        try {
            topic = execute("Fetch topic " + url,
                    get("/t/" + topicUrl.getSlug() + "/" + topicUrl.getTopicId() + ".json"));
        } catch (TopicNotFoundException e) {
            logger.debug("Topic not found: {}", url);
            return Optional.empty();
        }

        if (!topic.path("deleted_at").isMissingNode() && !topic.path("deleted_at").isNull()) {
            logger.debug("Topic has been deleted: {}", url);
            return Optional.empty();
        }
        JsonNode firstPost = firstPost(topic, url);
        if (firstPost.path("user_deleted").asBoolean(false)) {
            logger.debug("First post of topic has been deleted: {}", url);
            return Optional.empty();
        }

        long postId = requireLong(firstPost, "id");
        JsonNode post;
        try {
            post = execute("Fetch post " + postId, get("/posts/" + postId + ".json"));
        } catch (TopicNotFoundException e) {
            return Optional.empty();
        }
        String raw = requireText(post, "raw");

        return Optional.of(RemoteTopic.builder()
                .topicId(topicUrl.getTopicId())
                .url(url)
                .categoryId(topic.hasNonNull("category_id") ? topic.get("category_id").asInt() : null)
                .firstPostId(postId)
                .body(raw)
                .fingerprint(ContentFingerprint.of(raw))
                .build());
    }

    @Override
    public RemoteTopic createTopic(int categoryId, String title, String body) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("title", title);
        request.put("raw", body);
        request.put("category", categoryId);
        tags.forEach(request.putArray("tags")::add);

        Request create = post("/posts.json", request);
        JsonNode post = new RetryingCall<JsonNode>("Create topic '" + title + "'", retryPolicy, sleeper,
                () -> executeOnce(create)).nonIdempotent().execute();
        String slug = requireText(post, "topic_slug");
        long topicId = requireLong(post, "topic_id");

        return RemoteTopic.builder()
                .topicId(topicId)
                .url(topicUrl(slug, topicId))
                .categoryId(categoryId)
                .firstPostId(post.hasNonNull("id") ? post.get("id").asLong() : null)
                .body(body)
                .fingerprint(ContentFingerprint.of(body))
                .build();
    }

    @Override
    public RemoteTopic updateTopic(long topicId, String body) {
        JsonNode topic = execute("Fetch topic " + topicId, get("/t/" + topicId + ".json"));
        String url = topicUrl(requireText(topic, "slug"), topicId);
        long postId = requireLong(firstPost(topic, url), "id");

        ObjectNode request = objectMapper.createObjectNode();
        ObjectNode postNode = request.putObject("post");
        postNode.put("raw", body);
        postNode.put("edit_reason", EDIT_REASON);
        execute("Update topic " + url, put("/posts/" + postId + ".json", request));

        return RemoteTopic.builder()
                .topicId(topicId)
                .url(url)
                .categoryId(topic.hasNonNull("category_id") ? topic.get("category_id").asInt() : null)
                .firstPostId(postId)
                .body(body)
                .fingerprint(ContentFingerprint.of(body))
                .build();
    }

    @Override
    public boolean deleteTopic(long topicId) {
        try {
            execute("Delete topic " + topicId, delete("/t/" + topicId + ".json"));
            return true;
        } catch (TopicNotFoundException e) {
            logger.info("Topic {} was already gone", topicId);
            return false;
        }
    }

    private String topicUrl(String slug, long topicId) {
        return baseUrl + "/t/" + slug + "/" + topicId;
    }

    private JsonNode firstPost(JsonNode topic, String url) {
        for (JsonNode post : topic.path("post_stream").path("posts")) {
            if (post.path("post_number").asInt() == 1) {
                return post;
            }
        }
        throw new DiscourseException("The documentation server returned unexpected data, no first post for " + url);
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new DiscourseException(
                    "The documentation server returned unexpected data, missing '" + field + "' in " + node);
        }
        return value.asText();
    }

    private static long requireLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToLong()) {
            throw new DiscourseException(
                    "The documentation server returned unexpected data, missing '" + field + "' in " + node);
        }
        return value.asLong();
    }

    private Request get(String path) {
        return request(path).get().build();
    }

    private Request post(String path, JsonNode body) {
        return request(path).post(jsonBody(body)).build();
    }

    private Request put(String path, JsonNode body) {
        return request(path).put(jsonBody(body)).build();
    }

    private Request delete(String path) {
        return request(path).delete().build();
    }

    private Request.Builder request(String path) {
        return new Request.Builder()
                .url(baseUrl + path)
                .addHeader("Api-Key", apiKey)
                .addHeader("Api-Username", apiUsername)
                .addHeader("Accept", "application/json");
    }

    private RequestBody jsonBody(JsonNode body) {
        try {
            return RequestBody.create(objectMapper.writeValueAsString(body), JSON);
        } catch (IOException e) {
            throw new DiscourseException("Failed to serialize request body", e);
        }
    }

    private JsonNode execute(String description, Request request) {
        return new RetryingCall<>(description, retryPolicy, sleeper, () -> executeOnce(request)).execute();
    }

    private JsonNode executeOnce(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            int code = response.code();
            String body = response.body() != null ? response.body().string() : "";

            if (response.isSuccessful()) {
                if (body.isBlank()) {
                    return objectMapper.createObjectNode();
                }
                try {
                    return objectMapper.readTree(body);
                } catch (IOException e) {
                    throw new DiscourseException("The documentation server returned invalid JSON for "
                            + request.method() + " " + request.url().encodedPath(), e);
                }
            }

            String error = String.format("Discourse API error (HTTP %d) for %s %s: %s",
                    code, request.method(), request.url().encodedPath(), truncate(body));
            if (code == 401) {
                throw new AuthenticationException(error);
            }
            if (code == 403) {
                throw new PermissionDeniedException(error);
            }
            if (code == 404) {
                throw new TopicNotFoundException(error);
            }
            if (code == 429 || code >= 500) {
                throw new TransientResponseException(code, retryAfterMillis(response), error);
            }
            throw new DiscourseException(error);
        }
    }

    private static long retryAfterMillis(Response response) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter == null) {
            return 0;
        }
        try {
            return Long.parseLong(retryAfter.trim()) * 1000L;
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String truncate(String body) {
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
