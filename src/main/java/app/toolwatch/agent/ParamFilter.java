package app.toolwatch.agent;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Reduces tool arguments to what is worth auditing. File contents and edit bodies never
 * leave the agent.
 */
public final class ParamFilter {

    static final int MAX_STRING_LENGTH = 200;
    static final String TRUNCATED_SUFFIX = "...[truncated]";

    private static final Map<String, List<String>> KEPT_FIELDS = Map.of(
            "bash", List.of("command", "timeout"),
            "read", List.of("path", "offset", "limit"),
            "write", List.of("path"),
            "edit", List.of("path"),
            "grep", List.of("pattern", "path", "include"),
            "find", List.of("path", "pattern", "type"),
            "ls", List.of("path"));

    private ParamFilter() {
    }

    public static ObjectNode filter(String tool, JsonNode input) {
        ObjectNode filtered = JsonNodeFactory.instance.objectNode();
        if (input == null || !input.isObject()) {
            return filtered;
        }

        List<String> kept = KEPT_FIELDS.get(tool);
        if (kept != null) {
            for (String field : kept) {
                JsonNode value = input.get(field);
                if (value != null) {
                    filtered.set(field, value);
                }
            }
            return filtered;
        }

        // unbekanntes Tool: alles behalten, lange Strings kürzen
        Iterator<Map.Entry<String, JsonNode>> fields = input.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isTextual() && value.asText().length() > MAX_STRING_LENGTH) {
                filtered.put(field.getKey(), value.asText().substring(0, MAX_STRING_LENGTH) + TRUNCATED_SUFFIX);
            } else {
                filtered.set(field.getKey(), value);
            }
        }
        return filtered;
    }
}
