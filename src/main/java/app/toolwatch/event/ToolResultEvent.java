package app.toolwatch.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Completion of a tool call, correlated by {@code toolCallId}. Carries no approval semantics.
 *
 * @param durationMs milliseconds since the matching call, {@code -1} when the call was not seen
 * @param exitCode   process exit code, only present for shell tools
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolResultEvent(
        String toolCallId,
        long ts,
        @JsonProperty("isError") boolean isError,
        long durationMs,
        @JsonInclude(JsonInclude.Include.NON_NULL) Integer exitCode
) implements ToolwatchEvent {
}
