package ai.classtalk.backend.model.dto;

import ai.classtalk.backend.model.entity.FlagType;
import ai.classtalk.backend.model.entity.FlaggedContent;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Notification pushed to observers. Never persisted; the underlying
 * {@link FlaggedContent} record is the durable copy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertEvent {

    private AlertType type;

    private UUID sessionId;

    private String ownerDisplayName;

    private String flaggedWord;

    private long timestampMs;

    private String speaker;

    private String context;

    private FlagType flagType;

    public static AlertEvent fromFlag(FlaggedContent flag, String ownerDisplayName) {
        return AlertEvent.builder()
                .type(AlertType.forFlagType(flag.getFlagType()))
                .sessionId(flag.getSessionId())
                .ownerDisplayName(ownerDisplayName)
                .flaggedWord(flag.getFlaggedWord())
                .timestampMs(flag.getTimestampMs())
                .speaker(flag.getSpeaker())
                .context(flag.getContext())
                .flagType(flag.getFlagType())
                .build();
    }
}
