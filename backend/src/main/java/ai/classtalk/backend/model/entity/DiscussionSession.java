package ai.classtalk.backend.model.entity;

import ai.classtalk.backend.model.dto.ParticipationBalance;
import ai.classtalk.backend.model.dto.ParticipationConfig;
import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.converter.ParticipationBalanceConverter;
import ai.classtalk.backend.model.entity.converter.ParticipationConfigConverter;
import ai.classtalk.backend.model.entity.converter.SegmentListConverter;
import ai.classtalk.backend.model.entity.converter.StringListConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Represents a monitored group discussion and its incrementally built transcript.
 *
 * The {@code cursor} column always equals the number of committed segments and
 * acts as the optimistic-lock key for appends.
 */
@Entity
@Table(name = "discussion_session", indexes = {
        @Index(name = "idx_discussion_session_owner", columnList = "owner_id"),
        @Index(name = "idx_discussion_session_created", columnList = "created_at")
})
public class DiscussionSession {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "owner_display_name")
    private String ownerDisplayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SessionStatus status = SessionStatus.DRAFT;

    @Column(name = "language", length = 50)
    private String language;

    @Convert(converter = SegmentListConverter.class)
    @Column(name = "segments", columnDefinition = "TEXT", nullable = false)
    private List<TranscriptSegment> segments = new ArrayList<>();

    @Column(name = "segment_cursor", nullable = false)
    private int cursor;

    @Column(name = "profanity_count", nullable = false)
    private int profanityCount;

    @Column(name = "language_violation_count", nullable = false)
    private int languageViolationCount;

    @Column(name = "topic_prompt", columnDefinition = "TEXT")
    private String topicPrompt;

    @Convert(converter = StringListConverter.class)
    @Column(name = "topic_keywords", columnDefinition = "TEXT")
    private List<String> topicKeywords;

    @Convert(converter = ParticipationConfigConverter.class)
    @Column(name = "participation_config", columnDefinition = "TEXT")
    private ParticipationConfig participationConfig;

    @Convert(converter = ParticipationBalanceConverter.class)
    @Column(name = "participation_balance", columnDefinition = "TEXT")
    private ParticipationBalance participationBalance;

    @Column(name = "topic_adherence_score")
    private Double topicAdherenceScore;

    @Column(name = "duration")
    private Double duration;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    // Getters and setters

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public String getOwnerDisplayName() { return ownerDisplayName; }
    public void setOwnerDisplayName(String ownerDisplayName) { this.ownerDisplayName = ownerDisplayName; }

    public SessionStatus getStatus() { return status; }
    public void setStatus(SessionStatus status) { this.status = status; }

    public String getLanguage() { return language; }
    public void setLanguage(String language) { this.language = language; }

    public List<TranscriptSegment> getSegments() { return segments; }
    public void setSegments(List<TranscriptSegment> segments) { this.segments = segments; }

    public int getCursor() { return cursor; }
    public void setCursor(int cursor) { this.cursor = cursor; }

    public int getProfanityCount() { return profanityCount; }
    public void setProfanityCount(int profanityCount) { this.profanityCount = profanityCount; }

    public int getLanguageViolationCount() { return languageViolationCount; }
    public void setLanguageViolationCount(int languageViolationCount) { this.languageViolationCount = languageViolationCount; }

    public String getTopicPrompt() { return topicPrompt; }
    public void setTopicPrompt(String topicPrompt) { this.topicPrompt = topicPrompt; }

    public List<String> getTopicKeywords() { return topicKeywords; }
    public void setTopicKeywords(List<String> topicKeywords) { this.topicKeywords = topicKeywords; }

    public ParticipationConfig getParticipationConfig() { return participationConfig; }
    public void setParticipationConfig(ParticipationConfig participationConfig) { this.participationConfig = participationConfig; }

    public ParticipationBalance getParticipationBalance() { return participationBalance; }
    public void setParticipationBalance(ParticipationBalance participationBalance) { this.participationBalance = participationBalance; }

    public Double getTopicAdherenceScore() { return topicAdherenceScore; }
    public void setTopicAdherenceScore(Double topicAdherenceScore) { this.topicAdherenceScore = topicAdherenceScore; }

    public Double getDuration() { return duration; }
    public void setDuration(Double duration) { this.duration = duration; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
