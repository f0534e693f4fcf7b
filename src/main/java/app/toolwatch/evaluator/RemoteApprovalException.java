package app.toolwatch.evaluator;

/**
 * The collector answered, but not with a usable decision.
 */
public class RemoteApprovalException extends RuntimeException {

    public RemoteApprovalException(String message) {
        super(message);
    }
}
