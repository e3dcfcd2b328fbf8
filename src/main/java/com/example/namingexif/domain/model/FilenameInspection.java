package com.example.namingexif.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Read-only diagnostic for a single filename: the parsed record, every rule violation and,
 * for valid names, a preview of the tags that would be written.
 */
public record FilenameInspection(
        String filename,
        ParsedFilename parsed,
        List<Violation> violations,
        boolean valid,
        Map<String, String> tags
) {
}
