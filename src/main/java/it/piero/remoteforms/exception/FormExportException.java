package it.piero.remoteforms.exception;

public class FormExportException extends RuntimeException {

    public FormExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
