package com.archivesafrica.mailprocessor.exception;

/**
 * Raised when a required piece of configuration (mailbox, SMTP relay, report address,
 * directory layout) is missing or invalid. Fatal for the operation that needed it.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
