package ai.classtalk.backend.model.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinalizeSessionRequest {

    /**
     * Session length in seconds.
     */
    @NotNull(message = "Duration is required")
    @PositiveOrZero(message = "Duration must not be negative")
    private Double duration;

    /**
     * Identifier of the authoritative transcript at the external provider, if any.
     */
    @Size(max = 200, message = "Transcript reference must not exceed 200 characters")
    private String externalTranscriptRef;
}
