package im.arun.docsync.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Everything a collaborating tool needs to address the same forum category again.
 */
@Value
public class DiscourseConfigDescriptor {

    @JsonProperty("hostname")
    String hostname;

    @JsonProperty("category_id")
    int categoryId;

    @JsonProperty("api_username")
    String apiUsername;

    @JsonProperty("api_key")
    String apiKey;
}
