package app.toolwatch.storage;

/**
 * Raised when a tool call id is inserted a second time.
 */
public class DuplicateToolCallException extends RuntimeException {

    private final String toolCallId;

    public DuplicateToolCallException(String toolCallId) {
        super("Tool call already recorded: " + toolCallId);
        this.toolCallId = toolCallId;
    }

    public String getToolCallId() {
        return toolCallId;
    }
}
