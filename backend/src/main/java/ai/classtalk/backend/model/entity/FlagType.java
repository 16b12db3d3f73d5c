package ai.classtalk.backend.model.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a flagged content record. The wire value is what gets stored and serialized.
 */
public enum FlagType {
    PROFANITY("profanity"),
    LANGUAGE_POLICY("language_policy"),
    OFF_TOPIC("off_topic"),
    PARTICIPATION("participation");

    private final String value;

    FlagType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Flags derived from the whole transcript rather than from a single segment.
     */
    public boolean isAggregate() {
        return this == OFF_TOPIC || this == PARTICIPATION;
    }

    @JsonCreator
    public static FlagType fromValue(String value) {
        for (FlagType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown flag type: " + value);
    }
}
