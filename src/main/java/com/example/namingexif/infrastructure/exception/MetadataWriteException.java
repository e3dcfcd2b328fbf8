package com.example.namingexif.infrastructure.exception;

/**
 * Signals that ExifTool could not be started, did not finish, or rejected the requested tags.
 */
public class MetadataWriteException extends InfrastructureException {

    public MetadataWriteException(String message) {
        super(message);
    }

    public MetadataWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
