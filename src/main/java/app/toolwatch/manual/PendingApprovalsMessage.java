package app.toolwatch.manual;

import java.util.List;

import app.toolwatch.storage.ToolCallRecord;

/**
 * Push message for dashboard viewers: {@code {"type":"pending","pending":[...]}}.
 */
public record PendingApprovalsMessage(String type, List<ToolCallRecord> pending) {

    public static final String TYPE = "pending";

    public static PendingApprovalsMessage of(List<ToolCallRecord> pending) {
        return new PendingApprovalsMessage(TYPE, pending);
    }
}
