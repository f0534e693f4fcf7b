package app.toolwatch.rules;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Right-hand side of a match field: either a single pattern or a list of patterns
 * of which any may match.
 *
 * <p>A pattern wrapped in slashes ({@code /^rm /}) is a regular expression, anything
 * else is compared literally.
 */
public record MatchValue(List<String> patterns, boolean anyOf) {

    public MatchValue {
        patterns = List.copyOf(patterns);
    }

    public static MatchValue of(String pattern) {
        return new MatchValue(List.of(pattern), false);
    }

    public static MatchValue anyOf(String... patterns) {
        return new MatchValue(List.of(patterns), true);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MatchValue fromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Match value must not be null");
        }
        if (node.isArray()) {
            List<String> patterns = new ArrayList<>(node.size());
            node.forEach(element -> patterns.add(element.asText()));
            return new MatchValue(patterns, true);
        }
        if (node.isObject()) {
            throw new IllegalArgumentException("Match value must be a string or an array of strings");
        }
        return new MatchValue(List.of(node.asText()), false);
    }

    @JsonValue
    public Object toJson() {
        return anyOf ? patterns : patterns.get(0);
    }
}
