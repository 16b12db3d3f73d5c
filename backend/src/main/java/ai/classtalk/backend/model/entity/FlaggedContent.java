package ai.classtalk.backend.model.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A persisted policy violation detected in a session's transcript.
 */
@Entity
@Table(name = "flagged_content", indexes = {
        @Index(name = "idx_flagged_content_session", columnList = "session_id"),
        @Index(name = "idx_flagged_content_created", columnList = "created_at"),
        @Index(name = "idx_flagged_content_type", columnList = "flag_type")
})
public class FlaggedContent {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "flag_type", nullable = false, length = 30)
    private FlagType flagType;

    /**
     * The offending token, the detected language, or a sentinel such as {@code participation_dominance}.
     */
    @Column(name = "flagged_word", nullable = false)
    private String flaggedWord;

    @Column(name = "context", columnDefinition = "TEXT")
    private String context;

    @Column(name = "timestamp_ms", nullable = false)
    private long timestampMs;

    @Column(name = "speaker")
    private String speaker;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    // Getters and setters

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getSessionId() { return sessionId; }
    public void setSessionId(UUID sessionId) { this.sessionId = sessionId; }

    public FlagType getFlagType() { return flagType; }
    public void setFlagType(FlagType flagType) { this.flagType = flagType; }

    public String getFlaggedWord() { return flaggedWord; }
    public void setFlaggedWord(String flaggedWord) { this.flaggedWord = flaggedWord; }

    public String getContext() { return context; }
    public void setContext(String context) { this.context = context; }

    public long getTimestampMs() { return timestampMs; }
    public void setTimestampMs(long timestampMs) { this.timestampMs = timestampMs; }

    public String getSpeaker() { return speaker; }
    public void setSpeaker(String speaker) { this.speaker = speaker; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
