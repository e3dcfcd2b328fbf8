package com.example.namingexif.application.service;

import com.example.namingexif.application.exception.UseCaseValidationException;
import com.example.namingexif.domain.exception.UnparseableFilenameException;
import com.example.namingexif.domain.model.FilenameInspection;
import com.example.namingexif.domain.model.ParsedFilename;
import com.example.namingexif.domain.model.Violation;
import com.example.namingexif.domain.naming.FilenameParser;
import com.example.namingexif.domain.naming.FilenameValidator;
import com.example.namingexif.domain.naming.MetadataFormatter;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Application-layer service that explains how a filename would be handled without touching any file.
 */
@Service
public class FilenameInspectionService {

    private final FilenameParser parser;
    private final FilenameValidator validator;
    private final MetadataFormatter formatter;

    public FilenameInspectionService(FilenameParser parser, FilenameValidator validator, MetadataFormatter formatter) {
        this.parser = parser;
        this.validator = validator;
        this.formatter = formatter;
    }

    /**
     * Parses and validates the filename and previews the tags for valid names.
     *
     * @param filename bare filename
     * @return inspection result; the tag preview is empty when there are violations
     * @throws UseCaseValidationException   when no filename is given
     * @throws UnparseableFilenameException when the name does not follow the grammar
     */
    public FilenameInspection inspect(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new UseCaseValidationException("A filename is required.");
        }
        ParsedFilename parsed = parser.parse(filename)
                .orElseThrow(() -> new UnparseableFilenameException(filename));
        List<Violation> violations = validator.validate(parsed);
        boolean valid = violations.isEmpty();
        Map<String, String> tags = valid ? formatter.format(parsed).toTags() : Map.of();
        return new FilenameInspection(filename, parsed, violations, valid, tags);
    }
}
