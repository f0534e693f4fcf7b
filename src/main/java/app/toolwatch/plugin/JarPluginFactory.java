package app.toolwatch.plugin;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ServiceLoader;

import app.toolwatch.approval.ApprovalPlugin;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads a plugin from a {@code .jar} that registers its implementation under
 * {@code META-INF/services/app.toolwatch.approval.ApprovalPlugin}. Only providers defined
 * by the jar itself count, so a plugin already on the application classpath is not picked
 * up by accident.
 */
@Slf4j
public class JarPluginFactory implements PluginFactory {

    @Override
    public boolean supports(String reference) {
        return reference != null && reference.toLowerCase().endsWith(".jar");
    }

    @Override
    public ApprovalPlugin create(String reference, Path basePath) {
        Path jar = resolve(reference, basePath);
        if (!Files.isRegularFile(jar)) {
            throw new PluginLoadException("Plugin jar not found: " + jar);
        }

        URLClassLoader loader = newClassLoader(jar);
        for (ServiceLoader.Provider<ApprovalPlugin> provider
                : ServiceLoader.load(ApprovalPlugin.class, loader).stream().toList()) {
            if (provider.type().getClassLoader() == loader) {
                log.debug("Using {} from {}", provider.type().getName(), jar);
                return provider.get();
            }
        }

        closeQuietly(loader, jar);
        throw new PluginLoadException("No ApprovalPlugin service in " + jar);
    }

    static Path resolve(String reference, Path basePath) {
        Path path = Path.of(reference);
        if (path.isAbsolute() || basePath == null) {
            return path.normalize();
        }
        return basePath.resolve(path).normalize();
    }

    private static URLClassLoader newClassLoader(Path jar) {
        try {
            URL url = jar.toUri().toURL();
            return new URLClassLoader(new URL[] {url}, JarPluginFactory.class.getClassLoader());
        } catch (MalformedURLException ex) {
            throw new PluginLoadException("Invalid plugin path: " + jar, ex);
        }
    }

    private static void closeQuietly(URLClassLoader loader, Path jar) {
        try {
            loader.close();
        } catch (IOException ex) {
            log.debug("Could not close class loader for {}: {}", jar, ex.getMessage());
        }
    }
}
