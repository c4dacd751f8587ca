package com.powerguard.dispatch.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.powerguard.core.model.ActionableRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a batch document into actionable records, preserving order.
 * <p>
 * A batch is either a JSON array of actionables or an object whose {@code actionables}
 * field holds that array. Only a document of neither shape is rejected as a whole; an
 * entry that cannot be read becomes a {@linkplain ActionableRecord#malformed malformed}
 * record in its position, so every entry still yields exactly one result.
 */
@Component
public class ActionableBatchReader {

    private static final Logger log = LoggerFactory.getLogger(ActionableBatchReader.class);

    private final ObjectMapper objectMapper;

    public ActionableBatchReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ActionableRecord> read(Path file) throws IOException {
        return read(objectMapper.readTree(Files.readString(file)));
    }

    public List<ActionableRecord> read(String json) throws JsonProcessingException {
        return read(objectMapper.readTree(json));
    }

    /**
     * @throws IllegalArgumentException if the document has neither accepted shape
     */
    public List<ActionableRecord> read(JsonNode document) {
        JsonNode array = document;
        if (document != null && document.isObject()) {
            array = document.get("actionables");
        }
        if (array == null || !array.isArray()) {
            throw new IllegalArgumentException("Batch must be a JSON array or an object with an 'actionables' array");
        }

        var records = new ArrayList<ActionableRecord>(array.size());
        int position = 0;
        for (JsonNode element : array) {
            records.add(readEntry(element, position++));
        }
        return records;
    }

    private ActionableRecord readEntry(JsonNode element, int position) {
        if (!element.isObject()) {
            String defect = "expected a JSON object, got " + element.getNodeType().name().toLowerCase(Locale.ROOT);
            log.warn("Batch entry {} is malformed: {}", position, defect);
            return ActionableRecord.malformed("", defect);
        }
        try {
            return objectMapper.treeToValue(element, ActionableRequest.class).toRecord();
        } catch (JsonProcessingException e) {
            String id = idOf(element);
            String defect = describe(e);
            log.warn("Batch entry {} ('{}') is malformed: {}", position, id, defect);
            return ActionableRecord.malformed(id, defect);
        }
    }

    private static String idOf(JsonNode element) {
        JsonNode id = element.get("id");
        return id != null && id.isValueNode() && !id.isNull() ? id.asText() : "";
    }

    private static String describe(JsonProcessingException e) {
        String message = e.getOriginalMessage();
        if (e instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
            String field = mapping.getPath().get(0).getFieldName();
            if (field != null) {
                return "field '%s': %s".formatted(field, message);
            }
        }
        return message;
    }
}
