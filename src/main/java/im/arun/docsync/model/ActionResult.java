package im.arun.docsync.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ActionResult {

    @JsonProperty("action")
    ActionKind action;

    @JsonProperty("result")
    ActionOutcome result;
}
