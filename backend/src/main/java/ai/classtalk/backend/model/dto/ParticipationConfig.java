package ai.classtalk.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-session override of the participation thresholds.
 * A null threshold means "derive it from the speaker count".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParticipationConfig {

    @DecimalMin(value = "0.0", message = "Dominance threshold must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Dominance threshold must be between 0 and 1")
    private Double dominanceThreshold;

    @DecimalMin(value = "0.0", message = "Silence threshold must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Silence threshold must be between 0 and 1")
    private Double silenceThreshold;
}
