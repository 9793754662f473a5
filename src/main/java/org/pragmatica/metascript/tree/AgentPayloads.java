package org.pragmatica.metascript.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Decoding of {@code agent name [payload]} payload text.
 *
 * <p>The payload is tried, in order, as plain JSON, as the bracket display form (the
 * brackets standing for object braces, e.g. {@code ["action": "validate"]}), and finally
 * with unescaped backslashes escaped, which admits Windows paths written as is.
 */
public final class AgentPayloads {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private AgentPayloads() {}

    public static Optional<JsonNode> decode(String payload) {
        var text = payload.strip();
        return tryParse(text)
            .or(() -> tryParse("{" + text + "}"))
            .or(() -> tryParse("{" + text.replace("\\", "\\\\") + "}"))
            .or(() -> tryParse(text.replace("\\", "\\\\")));
    }

    private static Optional<JsonNode> tryParse(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readTree(text));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
