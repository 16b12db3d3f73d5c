package ai.classtalk.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A contiguous same-speaker span of transcribed speech.
 *
 * Segments are validated when they enter the system and are never edited
 * once committed to a session; finalization may only replace the whole list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TranscriptSegment {

    @NotBlank(message = "Speaker is required")
    @Size(max = 100, message = "Speaker label must not exceed 100 characters")
    private String speaker;

    @NotNull(message = "Text is required")
    @Size(max = 10000, message = "Segment text must not exceed 10000 characters")
    private String text;

    /**
     * Start of the segment in seconds from the beginning of the session.
     */
    @NotNull(message = "Start time is required")
    @PositiveOrZero(message = "Start time must not be negative")
    private Double startTime;

    /**
     * End of the segment in seconds from the beginning of the session.
     */
    @NotNull(message = "End time is required")
    @PositiveOrZero(message = "End time must not be negative")
    private Double endTime;

    /**
     * Detected language code or name, if the recognizer reported one.
     */
    @Size(max = 50, message = "Language must not exceed 50 characters")
    private String language;

    @JsonIgnore
    @AssertTrue(message = "End time must not be before start time")
    public boolean isTimingConsistent() {
        return startTime == null || endTime == null || endTime >= startTime;
    }

    /**
     * Whether the analyzers can safely use this segment.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        return speaker != null && !speaker.isBlank()
                && text != null
                && startTime != null && endTime != null
                && !startTime.isNaN() && !endTime.isNaN()
                && endTime >= startTime;
    }

    @JsonIgnore
    public double getDurationSeconds() {
        return endTime - startTime;
    }

    @JsonIgnore
    public long getStartMs() {
        return (long) Math.floor(startTime * 1000);
    }
}
