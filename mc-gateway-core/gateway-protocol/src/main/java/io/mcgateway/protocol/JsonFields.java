package io.mcgateway.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

final class JsonFields {
    private JsonFields() {
    }

    static JsonNode node(JsonNode parent, String... names) {
        if (parent == null || parent.isMissingNode() || parent.isNull()) {
            return NullNode.instance;
        }
        for (String name : names) {
            JsonNode value = parent.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return NullNode.instance;
    }

    static String text(JsonNode parent, String... names) {
        return asText(node(parent, names));
    }

    static String asText(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            String trimmed = value.asText().trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        if (value.isNumber() || value.isBoolean()) {
            return value.asText();
        }
        return null;
    }

    static String rawText(JsonNode parent, String... names) {
        JsonNode value = node(parent, names);
        if (value.isTextual()) {
            return value.asText();
        }
        return asText(value);
    }

    static String textOrDefault(JsonNode parent, String defaultValue, String... names) {
        String value = text(parent, names);
        return value == null ? defaultValue : value;
    }

    static boolean booleanOrDefault(JsonNode parent, boolean defaultValue, String... names) {
        JsonNode value = node(parent, names);
        if (value.isNull()) {
            return defaultValue;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            return text.isEmpty() ? defaultValue : Boolean.parseBoolean(text);
        }
        return defaultValue;
    }

    static int intOrDefault(JsonNode parent, int defaultValue, String... names) {
        Integer value = intOrNull(parent, names);
        return value == null ? defaultValue : value;
    }

    static Integer intOrNull(JsonNode parent, String... names) {
        JsonNode value = node(parent, names);
        if (value.isNumber()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return Integer.parseInt(text);
            } catch (NumberFormatException invalid) {
                throw new IllegalArgumentException("Field " + names[0] + " must be an integer: " + text, invalid);
            }
        }
        return null;
    }

    static long longOrDefault(JsonNode parent, long defaultValue, String... names) {
        Long value = longOrNull(parent, names);
        return value == null ? defaultValue : value;
    }

    static Long longOrNull(JsonNode parent, String... names) {
        JsonNode value = node(parent, names);
        if (value.isNumber()) {
            return value.longValue();
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException invalid) {
                throw new IllegalArgumentException("Field " + names[0] + " must be a number: " + text, invalid);
            }
        }
        return null;
    }

    static Double doubleOrNull(JsonNode parent, String... names) {
        JsonNode value = node(parent, names);
        if (value.isNumber()) {
            return value.doubleValue();
        }
        return null;
    }
}
