package app.toolwatch.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * An attempted tool call. {@code params} has already been reduced by the caller
 * (see {@code ParamFilter}) so it never carries file bodies or other large payloads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolCallEvent(
        String toolCallId,
        long ts,
        String user,
        String hostname,
        String session,
        String cwd,
        String model,
        String tool,
        JsonNode params
) implements ToolwatchEvent {

    public ToolCallEvent {
        if (params == null || params.isNull()) {
            params = JsonNodeFactory.instance.objectNode();
        }
    }

    /**
     * Every column that storage requires is present ({@code session} is optional).
     */
    @JsonIgnore
    public boolean hasRequiredFields() {
        return toolCallId != null && !toolCallId.isBlank() && user != null && hostname != null
                && cwd != null && model != null && tool != null;
    }
}
