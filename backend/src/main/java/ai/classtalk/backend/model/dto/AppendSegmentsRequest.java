package ai.classtalk.backend.model.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A batch of newly finalized segments, based on the cursor the client last saw.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppendSegmentsRequest {

    @NotEmpty(message = "At least one segment is required")
    @Size(max = 500, message = "At most 500 segments may be appended per batch")
    private List<@Valid TranscriptSegment> segments;

    /**
     * The cursor the batch starts at; must equal the stored cursor.
     */
    @NotNull(message = "fromIndex is required")
    @Min(value = 0, message = "fromIndex must not be negative")
    private Integer fromIndex;
}
