package net.vortexdevelopment.vattribute.config;

import org.jetbrains.annotations.Nullable;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Reads analyzer properties with support for:
 * - Environment variables (highest priority)
 * - System properties
 * - vattribute.properties file (lowest priority)
 */
public class Environment {

    public static final String PROPERTIES_FILE = "vattribute.properties";

    private static volatile Environment instance;
    private final Properties fileProperties;

    Environment(Properties fileProperties) {
        this.fileProperties = fileProperties;
    }

    /**
     * Get the singleton Environment instance, loading {@value #PROPERTIES_FILE} on first use.
     *
     * @return The Environment instance
     */
    public static Environment getInstance() {
        if (instance == null) {
            synchronized (Environment.class) {
                if (instance == null) {
                    instance = new Environment(loadProperties());
                }
            }
        }
        return instance;
    }

    /**
     * Looks for the properties file in the working directory first, then on the classpath.
     */
    private static Properties loadProperties() {
        Properties properties = new Properties();
        File propertiesFile = new File(System.getProperty("user.dir"), PROPERTIES_FILE);
        if (propertiesFile.isFile()) {
            try (FileInputStream inputStream = new FileInputStream(propertiesFile)) {
                properties.load(inputStream);
                return properties;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + propertiesFile.getAbsolutePath(), e);
            }
        }

        try (InputStream inputStream = Environment.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if (inputStream != null) {
                properties.load(inputStream);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read classpath resource " + PROPERTIES_FILE, e);
        }
        return properties;
    }

    /**
     * Get a property value with resolution priority:
     * 1. Environment variables (converted from dot notation to UPPER_SNAKE_CASE)
     * 2. System properties
     * 3. vattribute.properties file
     *
     * @param key The property key (dot notation, e.g., "vattribute.cache.enabled")
     * @return The property value, or null if not found
     */
    @Nullable
    public String getProperty(String key) {
        if (key == null || key.isEmpty()) {
            return null;
        }

        String value = System.getenv(convertToEnvKey(key));
        if (value != null) {
            return value;
        }

        value = System.getProperty(key);
        if (value != null) {
            return value;
        }

        return fileProperties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        String value = getProperty(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Get a property value as an integer.
     *
     * @param key The property key
     * @param defaultValue The default value if property is not found or invalid
     * @return The integer value
     */
    public int getPropertyAsInt(String key, int defaultValue) {
        String value = getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getPropertyAsBoolean(String key, boolean defaultValue) {
        String value = getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Convert a property key from dot notation to environment variable format.
     * Example: "vattribute.cache.enabled" -> "VATTRIBUTE_CACHE_ENABLED"
     */
    private String convertToEnvKey(String key) {
        return key.toUpperCase().replace('.', '_').replace('-', '_');
    }
}
