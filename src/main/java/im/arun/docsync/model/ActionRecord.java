package im.arun.docsync.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of reconciling one node, or the index topic.
 */
@Value
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionRecord {

    @JsonProperty("sequence")
    int sequence;

    @JsonProperty("path")
    String path;

    /** Topic URL after the action, the dry-run marker, or null for a group row. */
    @JsonProperty("url")
    String url;

    @JsonProperty("action")
    ActionKind kind;

    @JsonProperty("result")
    ActionOutcome outcome;

    @JsonProperty("message")
    String message;

    public ActionRecord(int sequence, String path, String url, ActionKind kind, ActionOutcome outcome) {
        this(sequence, path, url, kind, outcome, null);
    }

    public boolean hasTopicUrl() {
        return url != null && !url.isEmpty() && !NavigationEntry.NOT_CREATED_LINK.equals(url);
    }
}
