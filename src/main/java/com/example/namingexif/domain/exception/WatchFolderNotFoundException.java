package com.example.namingexif.domain.exception;

/**
 * Raised when a scan targets a folder that does not exist or is not a directory.
 */
public class WatchFolderNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing path as part of the message.
	 *
	 * @param path absolute or relative path that could not be resolved
	 */
    public WatchFolderNotFoundException(String path) {
        super("Watch folder not found: " + path);
    }
}
