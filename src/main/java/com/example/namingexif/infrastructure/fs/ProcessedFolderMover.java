package com.example.namingexif.infrastructure.fs;

import com.example.namingexif.config.NamingExifProperties;
import com.example.namingexif.infrastructure.exception.FileRelocationException;
import com.example.namingexif.infrastructure.exception.ProcessedFileExistsException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Moves handled files into a {@code processed} folder next to them so the watch folder only
 * ever contains pending work.
 */
@Service
public class ProcessedFolderMover {

    private static final Logger log = LoggerFactory.getLogger(ProcessedFolderMover.class);

    private final String processedDirectoryName;

    public ProcessedFolderMover(NamingExifProperties properties) {
        this.processedDirectoryName = properties.processedDirectoryName();
    }

    /**
     * Moves the file into the sibling processed folder, creating that folder on demand.
     *
     * @param file file to move
     * @return new location of the file
     * @throws ProcessedFileExistsException when a file with the same name was already processed
     * @throws FileRelocationException      when the file system refuses the move
     */
    public Path moveToProcessed(Path file) {
        Path processedDir = file.toAbsolutePath().getParent().resolve(processedDirectoryName);
        Path destination = processedDir.resolve(file.getFileName());

        try {
            Files.createDirectories(processedDir);
            if (Files.exists(destination, LinkOption.NOFOLLOW_LINKS)) {
                throw new ProcessedFileExistsException(destination);
            }
            Files.move(file, destination);
        } catch (FileAlreadyExistsException ex) {
            throw new ProcessedFileExistsException(destination);
        } catch (IOException ex) {
            throw new FileRelocationException("Failed to move file " + file + " to " + processedDir, ex);
        }

        log.info("  Moved to: {}", destination);
        return destination;
    }
}
