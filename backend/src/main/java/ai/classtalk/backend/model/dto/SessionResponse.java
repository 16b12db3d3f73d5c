package ai.classtalk.backend.model.dto;

import ai.classtalk.backend.model.entity.DiscussionSession;
import ai.classtalk.backend.model.entity.FlaggedContent;
import ai.classtalk.backend.model.entity.SessionStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * DTO returned for session reads and mutations.
 *
 * {@code flaggedContent} is filled on reads, {@code newFlaggedItems} only on appends.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionResponse {

    private UUID id;
    private String ownerId;
    private String ownerDisplayName;
    private SessionStatus status;
    private String language;

    @Builder.Default
    private List<TranscriptSegment> segments = new ArrayList<>();

    private int cursor;
    private int profanityCount;
    private int languageViolationCount;
    private String topicPrompt;
    private List<String> topicKeywords;
    private ParticipationConfig participationConfig;
    private ParticipationBalance participationBalance;
    private Double topicAdherenceScore;
    private Double duration;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<FlaggedContentResponse> flaggedContent;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<FlaggedContentResponse> newFlaggedItems;

    public static SessionResponse from(DiscussionSession session) {
        return SessionResponse.builder()
                .id(session.getId())
                .ownerId(session.getOwnerId())
                .ownerDisplayName(session.getOwnerDisplayName())
                .status(session.getStatus())
                .language(session.getLanguage())
                .segments(new ArrayList<>(session.getSegments()))
                .cursor(session.getCursor())
                .profanityCount(session.getProfanityCount())
                .languageViolationCount(session.getLanguageViolationCount())
                .topicPrompt(session.getTopicPrompt())
                .topicKeywords(session.getTopicKeywords())
                .participationConfig(session.getParticipationConfig())
                .participationBalance(session.getParticipationBalance())
                .topicAdherenceScore(session.getTopicAdherenceScore())
                .duration(session.getDuration())
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .build();
    }

    public static SessionResponse from(DiscussionSession session, List<FlaggedContent> flaggedContent) {
        SessionResponse response = from(session);
        response.setFlaggedContent(toResponses(flaggedContent));
        return response;
    }

    public static List<FlaggedContentResponse> toResponses(List<FlaggedContent> flags) {
        return flags.stream().map(FlaggedContentResponse::from).collect(Collectors.toList());
    }
}
