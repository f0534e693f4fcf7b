package app.toolwatch.agent;

/**
 * Answer to the host: run the tool, or block it with a reason shown to the model.
 */
public record ToolVerdict(boolean block, String reason) {

    private static final ToolVerdict PROCEED = new ToolVerdict(false, null);

    public static ToolVerdict proceed() {
        return PROCEED;
    }

    public static ToolVerdict block(String reason) {
        return new ToolVerdict(true, reason);
    }
}
