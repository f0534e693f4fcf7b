package app.toolwatch.evaluator;

import app.toolwatch.approval.ApprovalResponse;

/**
 * Remote decision plus whether the collector missed the event. When {@code auditFailed}
 * is set the caller writes its own audit record.
 */
public record RemoteEvaluationResult(boolean approved, String reason, boolean auditFailed) {

    static RemoteEvaluationResult of(ApprovalResponse response) {
        return new RemoteEvaluationResult(response.approved(), response.reason(), false);
    }

    public ApprovalResponse toResponse() {
        return new ApprovalResponse(approved, reason);
    }
}
