package im.arun.docsync.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionOutcome {
    SUCCESS,
    SKIP,
    FAIL;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
