package ai.classtalk.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of how talk time is spread across the speakers of a session.
 * Speakers are ordered by percentage, highest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParticipationBalance {

    @Builder.Default
    private List<SpeakerParticipation> speakers = new ArrayList<>();

    private String dominantSpeaker;

    @Builder.Default
    private List<String> silentSpeakers = new ArrayList<>();

    @JsonProperty("isBalanced")
    private boolean balanced;

    /**
     * Human readable explanation, present only when the session is unbalanced.
     */
    private String imbalanceReason;

    public static ParticipationBalance empty() {
        return ParticipationBalance.builder().balanced(true).build();
    }
}
