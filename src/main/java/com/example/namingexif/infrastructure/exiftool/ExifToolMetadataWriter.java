package com.example.namingexif.infrastructure.exiftool;

import com.example.namingexif.config.NamingExifProperties;
import com.example.namingexif.infrastructure.exception.MetadataWriteException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Infrastructure service that writes tags by running the ExifTool command line.
 * Hides process handling from the rest of the application.
 */
@Service
public class ExifToolMetadataWriter implements MetadataWriter {

    private static final Logger log = LoggerFactory.getLogger(ExifToolMetadataWriter.class);

    private final String command;
    private final Duration timeout;

    /**
     * Creates the writer from the {@code naming-exif.exiftool.*} settings.
     *
     * @param properties bound application properties
     */
    public ExifToolMetadataWriter(NamingExifProperties properties) {
        this.command = properties.exiftool().command();
        this.timeout = properties.exiftool().timeout();
    }

    @Override
    public void write(Path file, Map<String, String> tags) {
        ToolResult result = run(buildWriteCommand(file, tags));
        if (result.exitCode() != 0) {
            throw new MetadataWriteException("ExifTool exited with code " + result.exitCode()
                    + " while writing " + file + ": " + result.output());
        }
        log.debug("ExifTool output for {}: {}", file, result.output());
    }

    @Override
    public double toolVersion() {
        ToolResult result = run(List.of(command, "-ver"));
        if (result.exitCode() != 0) {
            throw new MetadataWriteException("ExifTool -ver exited with code " + result.exitCode());
        }
        try {
            return Double.parseDouble(result.output());
        } catch (NumberFormatException ex) {
            throw new MetadataWriteException("Unrecognized ExifTool version output: " + result.output(), ex);
        }
    }

    /**
     * Builds the ExifTool invocation that sets every tag, keeps the file modification date
     * ({@code -P}) and does not leave a {@code _original} backup behind.
     *
     * @param file target file
     * @param tags tags to assign
     * @return command line, executable first
     */
    List<String> buildWriteCommand(Path file, Map<String, String> tags) {
        List<String> arguments = new ArrayList<>();
        arguments.add(command);
        arguments.add("-P");
        arguments.add("-overwrite_original");
        tags.forEach((tag, value) -> arguments.add("-" + tag + "=" + value));
        arguments.add(file.toString());
        return arguments;
    }

    /**
     * Runs ExifTool, capturing stdout and stderr together in a temporary file so that the
     * configured timeout bounds the whole call.
     *
     * @param arguments command line
     * @return exit code and trimmed output
     * @throws MetadataWriteException when the process cannot be started, times out or is interrupted
     */
    private ToolResult run(List<String> arguments) {
        Path outputFile;
        try {
            outputFile = Files.createTempFile("exiftool-", ".out");
        } catch (IOException ex) {
            throw new MetadataWriteException("Unable to create ExifTool output file", ex);
        }

        try {
            Process process;
            try {
                process = new ProcessBuilder(arguments)
                        .redirectErrorStream(true)
                        .redirectOutput(outputFile.toFile())
                        .start();
            } catch (IOException ex) {
                throw new MetadataWriteException("Unable to start ExifTool (" + command + ")", ex);
            }

            try {
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    throw new MetadataWriteException("ExifTool did not finish within " + timeout);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                throw new MetadataWriteException("Interrupted while waiting for ExifTool", ex);
            }

            try {
                String text = Files.readString(outputFile, StandardCharsets.UTF_8).strip();
                return new ToolResult(process.exitValue(), text);
            } catch (IOException ex) {
                throw new MetadataWriteException("Unable to read ExifTool output", ex);
            }
        } finally {
            deleteOutput(outputFile);
        }
    }

    private void deleteOutput(Path outputFile) {
        try {
            Files.deleteIfExists(outputFile);
        } catch (IOException ex) {
            log.warn("Unable to delete ExifTool output file {}", outputFile, ex);
        }
    }

    private record ToolResult(int exitCode, String output) {
    }
}
