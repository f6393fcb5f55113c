package im.arun.docsync.discourse;

import im.arun.docsync.model.RemoteTopic;

import java.util.Optional;

/**
 * Operations the reconciliation needs from the forum.
 */
public interface TopicClient {

    /** Protocol and host every topic URL starts with, e.g. {@code https://discourse.example.com}. */
    String getBaseUrl();

    /**
     * Verify host, credentials and category before anything is changed.
     *
     * @throws im.arun.docsync.exception.AuthenticationException if the credentials are rejected
     * @throws im.arun.docsync.exception.HostUnreachableException if the host cannot be reached
     */
    void checkAccess();

    Optional<RemoteTopic> fetchTopic(String url);

    RemoteTopic createTopic(int categoryId, String title, String body);

    RemoteTopic updateTopic(long topicId, String body);

    /**
     * @return false if the topic did not exist
     */
    boolean deleteTopic(long topicId);
}
