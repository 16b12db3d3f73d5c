package ai.classtalk.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cumulative talk statistics for one speaker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpeakerParticipation {

    private String speakerId;

    /**
     * Total seconds of speech.
     */
    private double talkTime;

    private int segmentCount;

    /**
     * Share of the session's total talk time, in [0, 1].
     */
    private double percentage;
}
