package io.keepsake.core.config;

/**
 * The configuration file is missing, unreadable or invalid. Startup cannot continue.
 */
public final class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
