package com.example.namingexif.infrastructure.exception;

import java.nio.file.Path;

/**
 * Raised instead of overwriting a file that already sits in the processed folder.
 * The source file is left where it was.
 */
public class ProcessedFileExistsException extends FileRelocationException {

	/**
	 * @param destination path that is already taken
	 */
    public ProcessedFileExistsException(Path destination) {
        super("Destination file already exists: " + destination + ". Leaving source file in place.");
    }
}
