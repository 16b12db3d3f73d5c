package ai.classtalk.backend.model.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class MetadataConverter extends JsonAttributeConverter<Map<String, Object>> {

    public MetadataConverter() {
        super(new TypeReference<Map<String, Object>>() {});
    }
}
