package io.formulainline.tool.config;

import java.nio.file.Path;

/**
 * Thrown when the catalog tool's configuration cannot be resolved. The message is meant for the
 * command-line user.
 *
 * <p>
 * A failure is tied either to a whole configuration file (missing, not YAML, not a mapping) or to
 * one configuration key whose value is blank or unknown.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Path configPath;
    private final String key;

    private ConfigLoadException(String message, Path configPath, String key, Throwable cause) {
        super(message, cause);
        this.configPath = configPath;
        this.key = key;
    }

    /**
     * Creates a failure for a configuration file as a whole.
     *
     * @param message    description for the user
     * @param configPath the file that could not be used
     * @param cause      the underlying I/O or parse error, or null
     * @return the exception
     */
    public static ConfigLoadException forFile(String message, Path configPath, Throwable cause) {
        return new ConfigLoadException(message, configPath, null, cause);
    }

    /**
     * Creates a failure for one key, whether its value came from YAML, the environment or the
     * defaults.
     *
     * @param key     dotted configuration key, such as {@code logging.format}
     * @param message description for the user
     * @return the exception
     */
    public static ConfigLoadException forKey(String key, String message) {
        return new ConfigLoadException(message, null, key, null);
    }

    /** The configuration file at fault, or null for a key failure. */
    public Path configPath() {
        return configPath;
    }

    /** The configuration key at fault, or null for a file failure. */
    public String key() {
        return key;
    }
}
