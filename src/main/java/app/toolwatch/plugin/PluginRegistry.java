package app.toolwatch.plugin;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import app.toolwatch.approval.ApprovalPlugin;
import lombok.extern.slf4j.Slf4j;

/**
 * Name-keyed cache of approval plugins.
 *
 * <p>Built-in plugins are registered up front ({@code builtin:<name>} references resolve
 * only against those). Everything else is created on first use by the first
 * {@link PluginFactory} that supports the reference, then cached under the rule's plugin
 * name. {@link #load} never throws; a plugin that cannot be obtained is simply absent.
 */
@Slf4j
public class PluginRegistry {

    static final String BUILTIN_PREFIX = "builtin:";

    private final Map<String, ApprovalPlugin> plugins = new ConcurrentHashMap<>();
    private final List<PluginFactory> factories;

    public PluginRegistry() {
        this(List.of(new ClassPluginFactory(), new JarPluginFactory()));
    }

    public PluginRegistry(List<PluginFactory> factories) {
        this.factories = List.copyOf(factories);
    }

    public void register(String name, ApprovalPlugin plugin) {
        plugins.put(name, plugin);
        log.debug("Registered approval plugin '{}'", name);
    }

    public Optional<ApprovalPlugin> get(String name) {
        return Optional.ofNullable(plugins.get(name));
    }

    public boolean contains(String name) {
        return plugins.containsKey(name);
    }

    public Set<String> registeredNames() {
        return new TreeSet<>(plugins.keySet());
    }

    public void clear() {
        plugins.clear();
    }

    /**
     * Resolve a plugin by name.
     *
     * @param name      plugin name used by the rule
     * @param reference entry of the {@code plugins} map, may be {@code null}
     * @param basePath  directory of the rules file
     * @return the plugin, or empty if unknown or not loadable
     */
    public Optional<ApprovalPlugin> load(String name, String reference, Path basePath) {
        ApprovalPlugin cached = plugins.get(name);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (reference == null || reference.isBlank()) {
            log.warn("No reference configured for plugin '{}'", name);
            return Optional.empty();
        }
        if (reference.startsWith(BUILTIN_PREFIX)) {
            String builtin = reference.substring(BUILTIN_PREFIX.length());
            ApprovalPlugin plugin = plugins.get(builtin);
            if (plugin == null) {
                log.warn("Unknown builtin plugin '{}' referenced by '{}'", builtin, name);
                return Optional.empty();
            }
            plugins.put(name, plugin);
            return Optional.of(plugin);
        }

        for (PluginFactory factory : factories) {
            if (!factory.supports(reference)) {
                continue;
            }
            try {
                ApprovalPlugin plugin = factory.create(reference, basePath);
                ApprovalPlugin existing = plugins.putIfAbsent(name, plugin);
                log.info("Loaded approval plugin '{}' from {}", name, reference);
                return Optional.of(existing != null ? existing : plugin);
            } catch (RuntimeException | ServiceConfigurationError | LinkageError ex) {
                log.warn("Failed to load plugin '{}' from {}: {}", name, reference, ex.getMessage());
                return Optional.empty();
            }
        }
        log.warn("Unsupported plugin reference '{}' for '{}'", reference, name);
        return Optional.empty();
    }
}
