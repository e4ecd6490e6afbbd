package com.phillippitts.streamwatch.exception;

import java.nio.file.Path;

/**
 * Thrown when the roster/settings file cannot be read, parsed or validated.
 * Fatal during startup; on hot reload the previous configuration is kept instead.
 */
public class ConfigurationException extends StreamWatchException {

    private final Path configFile;

    public ConfigurationException(Path configFile, String message) {
        super("Invalid configuration " + configFile + ": " + message);
        this.configFile = configFile;
    }

    public ConfigurationException(Path configFile, String message, Throwable cause) {
        super("Invalid configuration " + configFile + ": " + message, cause);
        this.configFile = configFile;
    }

    public Path getConfigFile() {
        return configFile;
    }
}
