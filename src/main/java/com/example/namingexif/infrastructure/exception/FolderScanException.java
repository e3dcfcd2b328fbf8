package com.example.namingexif.infrastructure.exception;

/**
 * Raised when the contents of a watch folder cannot be listed.
 */
public class FolderScanException extends InfrastructureException {

    public FolderScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
