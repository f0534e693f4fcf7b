package app.toolwatch.evaluator;

/**
 * Where tool calls are evaluated on the agent side.
 */
public enum RulesMode {
    /** In-process against the local rules file. */
    LOCAL,
    /** Delegated to the collector over HTTP. */
    REMOTE,
    /** No gating, audit only. */
    NONE
}
