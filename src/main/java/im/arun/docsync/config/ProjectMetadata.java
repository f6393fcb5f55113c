package im.arun.docsync.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The parts of a project's {@code metadata.yaml} that concern its documentation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectMetadata {

    @JsonProperty("name")
    private String name;

    /** URL of the documentation index topic. */
    @JsonProperty("docs")
    private String docs;
}
