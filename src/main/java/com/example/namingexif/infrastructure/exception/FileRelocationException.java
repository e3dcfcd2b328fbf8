package com.example.namingexif.infrastructure.exception;

/**
 * Infrastructure-layer exception raised when a processed file cannot be moved to its destination folder.
 */
public class FileRelocationException extends InfrastructureException {

	/**
	 * @param message description of the attempted move
	 */
    public FileRelocationException(String message) {
        super(message);
    }

	/**
	 * @param message description of the attempted move
	 * @param cause   file system error
	 */
    public FileRelocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
