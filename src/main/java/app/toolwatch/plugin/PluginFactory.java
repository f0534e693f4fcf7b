package app.toolwatch.plugin;

import java.nio.file.Path;

import app.toolwatch.approval.ApprovalPlugin;

/**
 * Turns one kind of plugin reference from {@code rules.json} into a plugin instance.
 */
public interface PluginFactory {

    boolean supports(String reference);

    /**
     * @param reference reference as written in the rules file
     * @param basePath  directory relative references are resolved against, may be {@code null}
     * @throws PluginLoadException if nothing usable is found
     */
    ApprovalPlugin create(String reference, Path basePath);
}
