package app.toolwatch.storage;

import app.toolwatch.approval.ApprovalResponse;

/**
 * Stored approval columns of a single tool call.
 */
public record ApprovalState(ApprovalStatus status, String reason) {

    public boolean isResolved() {
        return status != null && status.isTerminal();
    }

    public ApprovalResponse toResponse() {
        return new ApprovalResponse(status == ApprovalStatus.APPROVED, reason);
    }
}
