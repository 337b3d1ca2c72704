package com.example.gcsconnector.exception;

/**
 * Raised at startup when the connector configuration cannot be used.
 * Always fatal: no uploader is started once this has been thrown.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
