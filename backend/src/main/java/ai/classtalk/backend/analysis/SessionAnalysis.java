package ai.classtalk.backend.analysis;

import ai.classtalk.backend.model.dto.ParticipationBalance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Full-session analysis result computed at finalization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionAnalysis {

    @Builder.Default
    private List<DetectedFlag> profanityFlags = new ArrayList<>();

    @Builder.Default
    private List<DetectedFlag> languagePolicyFlags = new ArrayList<>();

    @Builder.Default
    private List<DetectedFlag> participationFlags = new ArrayList<>();

    private ParticipationBalance participationBalance;

    private TopicAdherenceResult topicAdherence;

    public List<DetectedFlag> allFlags() {
        List<DetectedFlag> all = new ArrayList<>(profanityFlags);
        all.addAll(languagePolicyFlags);
        if (topicAdherence != null) {
            all.addAll(topicAdherence.getOffTopicFlags());
        }
        all.addAll(participationFlags);
        return all;
    }
}
