package app.toolwatch.agent;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool call as the host agent reports it, before filtering.
 *
 * @param input   raw tool arguments
 * @param session session file or id, may be {@code null}
 * @param model   active model id, {@code "unknown"} when {@code null}
 */
public record ToolInvocation(
        String toolCallId,
        String toolName,
        JsonNode input,
        String session,
        String cwd,
        String model
) {
}
