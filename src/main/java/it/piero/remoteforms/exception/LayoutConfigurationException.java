package it.piero.remoteforms.exception;

public class LayoutConfigurationException extends RuntimeException {

    public LayoutConfigurationException(String message) {
        super(message);
    }

    public LayoutConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
