package app.toolwatch.plugin;

import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;

import app.toolwatch.approval.ApprovalPlugin;

/**
 * {@code class:com.example.MyPlugin} - instantiates a class already on the classpath
 * through its public no-arg constructor.
 */
public class ClassPluginFactory implements PluginFactory {

    static final String PREFIX = "class:";

    private final ClassLoader classLoader;

    public ClassPluginFactory() {
        this(ClassPluginFactory.class.getClassLoader());
    }

    public ClassPluginFactory(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public boolean supports(String reference) {
        return reference != null && reference.startsWith(PREFIX);
    }

    @Override
    public ApprovalPlugin create(String reference, Path basePath) {
        String className = reference.substring(PREFIX.length()).trim();
        try {
            Class<?> type = Class.forName(className, true, classLoader);
            if (!ApprovalPlugin.class.isAssignableFrom(type)) {
                throw new PluginLoadException(className + " does not implement ApprovalPlugin");
            }
            return (ApprovalPlugin) type.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException ex) {
            throw new PluginLoadException("Class not found: " + className, ex);
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException
                 | InvocationTargetException ex) {
            throw new PluginLoadException("Cannot instantiate " + className, ex);
        }
    }
}
