package ai.classtalk.backend.model.entity.converter;

import ai.classtalk.backend.model.dto.ParticipationConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class ParticipationConfigConverter extends JsonAttributeConverter<ParticipationConfig> {

    public ParticipationConfigConverter() {
        super(new TypeReference<ParticipationConfig>() {});
    }
}
