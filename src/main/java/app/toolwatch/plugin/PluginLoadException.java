package app.toolwatch.plugin;

/**
 * A plugin reference could not be turned into an {@link app.toolwatch.approval.ApprovalPlugin}.
 * Stays inside the registry, which reports it as "not found".
 */
public class PluginLoadException extends RuntimeException {

    public PluginLoadException(String message) {
        super(message);
    }

    public PluginLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
