package com.example.namingexif.infrastructure.exiftool;

import com.example.namingexif.infrastructure.exception.MetadataWriteException;

import java.nio.file.Path;
import java.util.Map;

/**
 * Writes embedded metadata into an image file in place.
 */
public interface MetadataWriter {

    /**
     * Writes every tag into the file, overwriting the original.
     *
     * @param file image file to update
     * @param tags tag name to value, e.g. {@code EXIF:DateTimeOriginal -> 1950:06:15 12:30:45}
     * @throws MetadataWriteException when the tool fails or rejects the tags
     */
    void write(Path file, Map<String, String> tags);

    /**
     * Reports the version of the underlying tool.
     *
     * @return version number as published by the tool, e.g. {@code 12.76}
     * @throws MetadataWriteException when the tool cannot be run
     */
    double toolVersion();
}
