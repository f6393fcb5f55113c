package im.arun.docsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one synchronization run.
 */
@Value
public class SyncReport {

    /** Topic URL to the action taken, in document order with the index last. */
    @JsonProperty("urls_with_actions")
    Map<String, ActionResult> urlsWithActions;

    @JsonProperty("index_url")
    String indexUrl;

    @JsonProperty("discourse_config")
    DiscourseConfigDescriptor discourseConfig;

    /** Every planned or executed action, including group rows and dry-run creates. */
    @JsonIgnore
    List<ActionRecord> records;

    @JsonIgnore
    public boolean hasFailures() {
        return records.stream().anyMatch(record -> record.getOutcome() == ActionOutcome.FAIL);
    }
}
