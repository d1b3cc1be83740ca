package netops.gateway.executor;

import com.fasterxml.jackson.databind.JsonNode;
import netops.gateway.error.ValidationException;

/**
 * Field checks shared by handler {@code validate} implementations.
 */
final class Payloads {

    private Payloads() {
    }

    static String requireText(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new ValidationException("Field 'data." + field + "' is required and must be a non-empty string");
        }
        return node.asText();
    }

    static void optionalText(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node != null && !node.isNull() && !node.isTextual()) {
            throw new ValidationException("Field 'data." + field + "' must be a string");
        }
    }

    static int requirePositiveInt(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || !node.canConvertToInt() || !node.isIntegralNumber() || node.asInt() <= 0) {
            throw new ValidationException("Field 'data." + field + "' is required and must be a positive integer");
        }
        return node.asInt();
    }

    static int optionalPort(JsonNode payload, String field, int defaultPort) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return defaultPort;
        }
        if (!node.isIntegralNumber() || node.asInt() < 1 || node.asInt() > 65535) {
            throw new ValidationException("Field 'data." + field + "' must be a port number");
        }
        return node.asInt();
    }

    static String text(JsonNode payload, String field, String defaultValue) {
        JsonNode node = payload.get(field);
        return node != null && node.isTextual() && !node.asText().isBlank() ? node.asText() : defaultValue;
    }
}
