package ai.classtalk.backend.model.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a discussion session: DRAFT -> RECONCILING -> COMPLETE.
 * COMPLETE is terminal.
 */
public enum SessionStatus {
    DRAFT,
    RECONCILING,
    COMPLETE;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
