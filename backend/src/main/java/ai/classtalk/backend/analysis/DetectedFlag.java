package ai.classtalk.backend.analysis;

import ai.classtalk.backend.model.entity.FlagType;
import ai.classtalk.backend.model.entity.FlaggedContent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Analyzer output: a violation that has not been persisted yet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectedFlag {

    private UUID sessionId;
    private FlagType flagType;
    private String flaggedWord;
    private String context;
    private long timestampMs;
    private String speaker;

    /**
     * Identity used to avoid storing the same observation twice.
     */
    public String dedupKey() {
        return flagType.getValue() + "|" + timestampMs + "|" + speaker + "|" + flaggedWord;
    }

    public static String dedupKey(FlaggedContent stored) {
        return stored.getFlagType().getValue() + "|" + stored.getTimestampMs() + "|"
                + stored.getSpeaker() + "|" + stored.getFlaggedWord();
    }

    public FlaggedContent toEntity() {
        FlaggedContent entity = new FlaggedContent();
        entity.setSessionId(sessionId);
        entity.setFlagType(flagType);
        entity.setFlaggedWord(flaggedWord);
        entity.setContext(context);
        entity.setTimestampMs(timestampMs);
        entity.setSpeaker(speaker);
        entity.setCreatedAt(Instant.now());
        return entity;
    }
}
