package com.example.intent.llm;

import java.util.function.Predicate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decodes JSON produced by a language model. Markdown fences and leading chatter are
 * stripped before parsing; field accessors never throw and fall back to the supplied default
 * when a field is missing or has the wrong type.
 */
public final class ModelOutputDecoder {

    private static final ObjectMapper mapper = new ObjectMapper();

    private ModelOutputDecoder() {
    }

    public static ParseResult<JsonNode> readObject(String raw) {
        return requireShape(read(raw), JsonNode::isObject, "expected a JSON object");
    }

    public static ParseResult<JsonNode> readArray(String raw) {
        return requireShape(read(raw), JsonNode::isArray, "expected a JSON array");
    }

    static String stripFences(String raw) {
        String content = raw.strip();
        if (content.startsWith("```")) {
            content = content.replaceAll("```(?:json)?\\s*", "").replaceAll("```\\s*$", "").strip();
        }
        if (!content.startsWith("{") && !content.startsWith("[")) {
            int object = content.indexOf('{');
            int array = content.indexOf('[');
            int start = object < 0 ? array : array < 0 ? object : Math.min(object, array);
            if (start > 0) {
                content = content.substring(start);
            }
        }
        return content;
    }

    public static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        if (value != null && value.isTextual()) {
            return value.asText();
        }
        return defaultValue;
    }

    public static double number(JsonNode node, String field, double defaultValue) {
        JsonNode value = node.get(field);
        if (value == null) {
            return defaultValue;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().strip());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * A confidence field, clamped to [0, 1]. NaN reads as 0.
     */
    public static double confidence(JsonNode node, String field, double defaultValue) {
        return clamp01(number(node, field, defaultValue));
    }

    public static double clamp01(double value) {
        return Double.isNaN(value) ? 0.0 : Math.max(0.0, Math.min(1.0, value));
    }

    public static int integer(JsonNode node, String field, int defaultValue) {
        JsonNode value = node.get(field);
        if (value != null && value.isNumber()) {
            return value.asInt();
        }
        return defaultValue;
    }

    public static boolean bool(JsonNode node, String field, boolean defaultValue) {
        JsonNode value = node.get(field);
        if (value != null && value.isBoolean()) {
            return value.asBoolean();
        }
        return defaultValue;
    }

    public static String toJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static ParseResult<JsonNode> read(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParseResult.error(ParseError.of("empty response", raw));
        }
        try {
            JsonNode root = mapper.readTree(stripFences(raw));
            if (root == null || root.isMissingNode()) {
                return ParseResult.error(ParseError.of("no JSON content", raw));
            }
            return ParseResult.ok(root);
        } catch (JsonProcessingException e) {
            return ParseResult.error(ParseError.of(e.getOriginalMessage(), raw));
        }
    }

    private static ParseResult<JsonNode> requireShape(ParseResult<JsonNode> parsed,
                                                      Predicate<JsonNode> shape, String reason) {
        if (!parsed.isOk() || shape.test(parsed.value())) {
            return parsed;
        }
        return ParseResult.error(ParseError.of(reason, parsed.value().toString()));
    }
}
