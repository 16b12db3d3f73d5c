package ai.classtalk.backend.model.dto;

import ai.classtalk.backend.model.entity.FlagType;

/**
 * Kinds of events pushed to connected observers.
 */
public enum AlertType {
    PROFANITY_ALERT,
    LANGUAGE_POLICY_ALERT,
    PARTICIPATION_ALERT,
    TOPIC_ADHERENCE_ALERT;

    public static AlertType forFlagType(FlagType flagType) {
        switch (flagType) {
            case PROFANITY:
                return PROFANITY_ALERT;
            case LANGUAGE_POLICY:
                return LANGUAGE_POLICY_ALERT;
            case PARTICIPATION:
                return PARTICIPATION_ALERT;
            case OFF_TOPIC:
                return TOPIC_ADHERENCE_ALERT;
            default:
                throw new IllegalArgumentException("Unsupported flag type: " + flagType);
        }
    }
}
