package ai.classtalk.backend.model.dto;

import ai.classtalk.backend.model.entity.FlagType;
import ai.classtalk.backend.model.entity.FlaggedContent;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlaggedContentResponse {

    private UUID id;
    private UUID sessionId;
    private FlagType flagType;
    private String flaggedWord;
    private String context;
    private long timestampMs;
    private String speaker;
    private Instant createdAt;

    public static FlaggedContentResponse from(FlaggedContent flag) {
        return FlaggedContentResponse.builder()
                .id(flag.getId())
                .sessionId(flag.getSessionId())
                .flagType(flag.getFlagType())
                .flaggedWord(flag.getFlaggedWord())
                .context(flag.getContext())
                .timestampMs(flag.getTimestampMs())
                .speaker(flag.getSpeaker())
                .createdAt(flag.getCreatedAt())
                .build();
    }
}
