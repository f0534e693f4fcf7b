package app.toolwatch.approval;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Terminal output of every evaluation path: allow or block, optionally with a reason
 * that is shown to the agent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovalResponse(boolean approved, String reason) {

    public static ApprovalResponse approve() {
        return new ApprovalResponse(true, null);
    }

    public static ApprovalResponse approve(String reason) {
        return new ApprovalResponse(true, reason);
    }

    public static ApprovalResponse deny(String reason) {
        return new ApprovalResponse(false, reason);
    }
}
