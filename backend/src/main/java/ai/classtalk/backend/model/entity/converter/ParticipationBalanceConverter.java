package ai.classtalk.backend.model.entity.converter;

import ai.classtalk.backend.model.dto.ParticipationBalance;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class ParticipationBalanceConverter extends JsonAttributeConverter<ParticipationBalance> {

    public ParticipationBalanceConverter() {
        super(new TypeReference<ParticipationBalance>() {});
    }
}
