package im.arun.docsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Outcome of migrating an index topic and its documents into a local directory.
 */
@Value
public class MigrationReport {

    @JsonProperty("docs_path")
    String docsPath;

    @JsonProperty("index_url")
    String indexUrl;

    /** Files in table order, the index file first. */
    @JsonProperty("migrated")
    List<MigrationRecord> records;

    @JsonIgnore
    public boolean hasFailures() {
        return records.stream().anyMatch(record -> record.getOutcome() == ActionOutcome.FAIL);
    }
}
