package uk.gegc.learnhub.features.purchase.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Stores the item snapshot taken at checkout as a JSON object.
 */
@Converter
public class PurchaseMetadataConverter implements AttributeConverter<Map<String, String>, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, String>> TYPE_REF = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Map<String, String> attribute) {
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute == null ? Map.of() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize purchase metadata", e);
        }
    }

    @Override
    public Map<String, String> convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return new HashMap<>();
        }
        try {
            Map<String, String> parsed = OBJECT_MAPPER.readValue(dbData, TYPE_REF);
            return parsed != null ? new HashMap<>(parsed) : new HashMap<>();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize purchase metadata", e);
        }
    }
}
