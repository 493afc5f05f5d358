package com.example.cruisesync.infrastructure.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes vendor bytes into a JSON object, undoing the two known corruptions:
 * <ul>
 *   <li>the document serialized as {@code {"0":"{","1":"\"",...}}, one character per key</li>
 *   <li>the document stored as a JSON string holding JSON text</li>
 * </ul>
 */
public class PayloadDecoder {

    private static final Logger log = LoggerFactory.getLogger(PayloadDecoder.class);

    private static final int MAX_RECOVERY_STEPS = 3;

    private final ObjectMapper objectMapper;

    public PayloadDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode decode(byte[] raw) {
        if (raw == null || raw.length == 0) {
            throw new CorruptPayloadException("Empty payload");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new CorruptPayloadException("Payload is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CorruptPayloadException("Payload cannot be read: " + e.getMessage(), e);
        }
        for (int step = 0; step < MAX_RECOVERY_STEPS; step++) {
            if (node == null || node.isMissingNode() || node.isNull()) {
                throw new CorruptPayloadException("Payload is empty JSON");
            }
            if (node.isTextual()) {
                log.debug("PAYLOAD_UNWRAP_STRING length={}", node.textValue().length());
                node = reparse(node.textValue(), "JSON string payload");
                continue;
            }
            if (isCharacterIndexed(node)) {
                log.debug("PAYLOAD_CHAR_INDEXED keys={}", node.size());
                node = reparse(reconstruct(node), "character-indexed payload");
                continue;
            }
            break;
        }
        if (node == null || !node.isObject()) {
            throw new CorruptPayloadException("Payload root is not an object");
        }
        return node;
    }

    /**
     * True when the object's keys are exactly {@code "0".."N-1"}.
     */
    static boolean isCharacterIndexed(JsonNode node) {
        if (!node.isObject() || node.size() == 0) {
            return false;
        }
        int size = node.size();
        for (int i = 0; i < size; i++) {
            if (!node.has(Integer.toString(i))) {
                return false;
            }
        }
        return true;
    }

    static String reconstruct(JsonNode node) {
        int size = node.size();
        StringBuilder sb = new StringBuilder(size);
        for (int i = 0; i < size; i++) {
            JsonNode value = node.get(Integer.toString(i));
            if (value == null || !value.isValueNode() || value.isNull()) {
                throw new CorruptPayloadException("Character-indexed payload has a non-character value at index " + i);
            }
            sb.append(value.asText());
        }
        return sb.toString();
    }

    private JsonNode reparse(String text, String what) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new CorruptPayloadException("Cannot recover " + what + ": " + e.getOriginalMessage(), e);
        }
    }
}
