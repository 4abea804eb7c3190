package uk.gegc.educore.features.attempt.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * JSON columns of attempts and responses.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AttemptJson {

    private final ObjectMapper objectMapper;

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize attempt data", e);
        }
    }

    /**
     * @return the stored value, or {@code null} when the column is empty or unreadable
     */
    public JsonNode readTree(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable stored JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    public <T> T read(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable stored {}: {}", type.getSimpleName(), e.getOriginalMessage());
            return null;
        }
    }
}
