package org.metalad.exceptions;

/**
 * An exception thrown when a pipeline or extractor configuration names an unknown stage or
 * extractor, or carries invalid arguments.
 */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
