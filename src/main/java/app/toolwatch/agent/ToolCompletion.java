package app.toolwatch.agent;

/**
 * Result notification from the host agent.
 *
 * @param exitCode shell exit code, {@code null} for other tools
 */
public record ToolCompletion(String toolCallId, String toolName, boolean isError, Integer exitCode) {
}
