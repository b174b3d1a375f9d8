package it.unimib.datai.podman.client.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Error document returned by the service on failed calls:
 * {@code {"cause": "...", "message": "...", "response": 404}}.
 */
public record ErrorBody(String cause, String message, Integer response) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static ErrorBody empty() {
        return new ErrorBody(null, null, null);
    }

    /**
     * Lenient: anything that is not a JSON object yields an empty body.
     */
    public static ErrorBody fromBody(String body) {
        if (body == null || body.isBlank()) {
            return empty();
        }
        try {
            JsonNode root = MAPPER.readTree(body);
            if (root == null || !root.isObject()) {
                return empty();
            }
            String cause = text(root, "cause");
            String message = text(root, "message");
            JsonNode code = root.path("response");
            Integer response = code.canConvertToInt() ? code.asInt() : null;
            return new ErrorBody(cause, message, response);
        } catch (Exception ignored) {
            return empty();
        }
    }

    private static String text(JsonNode root, String field) {
        JsonNode v = root.path(field);
        if (v.isMissingNode() || v.isNull()) {
            return null;
        }
        return v.asText(null);
    }
}
