package net.vortexdevelopment.vattribute.debug;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Debug logger used by the analyzer and its caches.
 * Output is opt-in, either globally via {@code vattribute.debug.all} or per class via {@link #enableDebugFor(Class[])}.
 */
public class DebugLogger {

    private static final Set<String> enabledClasses = ConcurrentHashMap.newKeySet();
    private static volatile boolean globalDebug = Boolean.getBoolean("vattribute.debug.all");

    /**
     * Enable debug logging for the given classes.
     */
    public static void enableDebugFor(Class<?>... classes) {
        for (Class<?> clazz : classes) {
            enabledClasses.add(clazz.getName());
        }
    }

    /**
     * Check if debug logging is enabled for a class.
     */
    public static boolean isEnabled(Class<?> clazz) {
        return globalDebug || enabledClasses.contains(clazz.getName());
    }

    /**
     * Log a formatted debug message for a specific class.
     *
     * @param clazz the class to log for
     * @param format the format string
     * @param args the arguments
     */
    public static void log(Class<?> clazz, String format, Object... args) {
        if (isEnabled(clazz)) {
            print(clazz, String.format(format, args));
        }
    }

    private static void print(Class<?> clazz, String message) {
        System.out.println("[DEBUG:" + clazz.getSimpleName() + "] " + message);
    }

    /**
     * Clear all enabled debug classes and re-read the global switch from {@code vattribute.debug.all} (for testing).
     */
    public static void clearAll() {
        enabledClasses.clear();
        globalDebug = Boolean.getBoolean("vattribute.debug.all");
    }
}
