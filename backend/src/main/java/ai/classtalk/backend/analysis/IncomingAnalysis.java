package ai.classtalk.backend.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags produced for one appended batch. Topic adherence is never part of it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncomingAnalysis {

    @Builder.Default
    private List<DetectedFlag> profanityFlags = new ArrayList<>();

    @Builder.Default
    private List<DetectedFlag> languagePolicyFlags = new ArrayList<>();

    @Builder.Default
    private List<DetectedFlag> participationFlags = new ArrayList<>();

    /**
     * All flags in segment order: profanity, then language policy, then participation per segment.
     */
    @Builder.Default
    private List<DetectedFlag> allFlags = new ArrayList<>();
}
