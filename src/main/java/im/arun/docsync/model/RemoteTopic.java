package im.arun.docsync.model;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of a topic on the Discourse server as seen during the current run.
 */
@Value
@Builder(toBuilder = true)
public class RemoteTopic {
    long topicId;
    String url;
    Integer categoryId;
    Long firstPostId;
    String body;
    String fingerprint;
    @Builder.Default
    boolean exists = true;
}
