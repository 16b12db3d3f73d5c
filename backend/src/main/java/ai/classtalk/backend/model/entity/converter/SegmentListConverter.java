package ai.classtalk.backend.model.entity.converter;

import ai.classtalk.backend.model.dto.TranscriptSegment;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered JSON array of transcript segments.
 */
@Converter
public class SegmentListConverter extends JsonAttributeConverter<List<TranscriptSegment>> {

    public SegmentListConverter() {
        super(new TypeReference<List<TranscriptSegment>>() {});
    }

    @Override
    public List<TranscriptSegment> convertToEntityAttribute(String dbData) {
        List<TranscriptSegment> segments = super.convertToEntityAttribute(dbData);
        return segments != null ? segments : new ArrayList<>();
    }
}
