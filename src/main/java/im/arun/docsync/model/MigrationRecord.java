package im.arun.docsync.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One file written while migrating topics into a documentation directory.
 */
@Value
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MigrationRecord {

    /** Navigation path of the row the file comes from, null for the index file. */
    @JsonProperty("path")
    String path;

    /** File relative to the documentation directory. */
    @JsonProperty("location")
    String location;

    @JsonProperty("url")
    String url;

    @JsonProperty("result")
    ActionOutcome outcome;

    @JsonProperty("message")
    String message;
}
