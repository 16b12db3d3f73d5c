package ai.classtalk.backend.model.entity.converter;

import ai.classtalk.backend.model.entity.FlagType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists flag types under their lowercase wire value.
 */
@Converter(autoApply = true)
public class FlagTypeConverter implements AttributeConverter<FlagType, String> {

    @Override
    public String convertToDatabaseColumn(FlagType attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public FlagType convertToEntityAttribute(String dbData) {
        return dbData != null ? FlagType.fromValue(dbData) : null;
    }
}
