package im.arun.docsync.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionKind {
    CREATE,
    UPDATE,
    DELETE,
    SKIP;

    /** Whether the action changes a topic on the server when it is applied. */
    public boolean isMutating() {
        return this != SKIP;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
