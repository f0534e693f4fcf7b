package app.toolwatch.manual.events;

import java.time.Instant;
import java.util.List;

import app.toolwatch.storage.ToolCallRecord;
import lombok.Builder;
import lombok.Data;

/**
 * Event mit der vollständigen Liste offener Freigaben.
 * Wird vom {@code ManualApprovalCoordinator} published und von WebSocket- und SSE-Streams konsumiert.
 */
@Data
@Builder
public class PendingApprovalsChangedEvent {

    private List<ToolCallRecord> pending;
    private Instant timestamp;
}
