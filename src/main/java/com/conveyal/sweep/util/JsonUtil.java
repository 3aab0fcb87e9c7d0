package com.conveyal.sweep.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import spark.ResponseTransformer;

import java.io.IOException;

/**
 * A library containing static methods for working with JSON. Upstream responses are read as trees rather than bound
 * to classes, because their shape is loose and only a few fields matter to each adapter.
 */
public abstract class JsonUtil {

    /**
     * Upstream APIs add fields all the time, so this mapper ignores anything it does not recognize.
     */
    public static final ObjectMapper objectMapper = createObjectMapper();

    public static final ResponseTransformer toJson = JsonUtil::toJsonString;

    private static ObjectMapper createObjectMapper () {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return objectMapper;
    }

    public static ObjectNode objectNode () {
        return objectMapper.createObjectNode();
    }

    public static JsonNode readTree (String body) throws IOException {
        return objectMapper.readTree(body);
    }

    public static String toJsonString (Object object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    /** Text of a field, or null when the field is missing, null, or empty. Paths are separated by slashes. */
    public static String text (JsonNode node, String pointer) {
        JsonNode value = node.at(pointer);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    /** First non-null text among several alternative fields. */
    public static String firstText (JsonNode node, String... pointers) {
        for (String pointer : pointers) {
            String text = text(node, pointer);
            if (text != null) {
                return text;
            }
        }
        return null;
    }

}
