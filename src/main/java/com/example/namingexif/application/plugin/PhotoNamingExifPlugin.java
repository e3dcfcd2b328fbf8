package com.example.namingexif.application.plugin;

import com.example.namingexif.config.NamingExifProperties;
import com.example.namingexif.domain.model.MetadataValues;
import com.example.namingexif.domain.model.ParsedFilename;
import com.example.namingexif.domain.model.Violation;
import com.example.namingexif.domain.naming.FilenameParser;
import com.example.namingexif.domain.naming.FilenameValidator;
import com.example.namingexif.domain.naming.MetadataFormatter;
import com.example.namingexif.infrastructure.exception.FileRelocationException;
import com.example.namingexif.infrastructure.exception.MetadataWriteException;
import com.example.namingexif.infrastructure.exiftool.MetadataWriter;
import com.example.namingexif.infrastructure.fs.ProcessedFolderMover;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Plugin that extracts metadata from structured photo filenames, writes it to EXIF/XMP and
 * moves the file into the {@code processed} folder.
 */
@Service
public class PhotoNamingExifPlugin implements FileProcessorPlugin {

    private static final Logger log = LoggerFactory.getLogger(PhotoNamingExifPlugin.class);

    static final String NAME = "naming_exif";
    static final String VERSION = "0.1.0";

    private final FilenameParser parser;
    private final FilenameValidator validator;
    private final MetadataFormatter formatter;
    private final MetadataWriter metadataWriter;
    private final ProcessedFolderMover mover;
    private final String processedDirectoryName;
    private final Set<String> supportedExtensions;
    private final double minimumToolVersion;

    private volatile boolean toolVersionChecked;

    public PhotoNamingExifPlugin(FilenameParser parser,
                                 FilenameValidator validator,
                                 MetadataFormatter formatter,
                                 MetadataWriter metadataWriter,
                                 ProcessedFolderMover mover,
                                 NamingExifProperties properties) {
        this.parser = parser;
        this.validator = validator;
        this.formatter = formatter;
        this.metadataWriter = metadataWriter;
        this.mover = mover;
        this.processedDirectoryName = properties.processedDirectoryName();
        this.supportedExtensions = properties.supportedExtensions().stream()
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.minimumToolVersion = properties.exiftool().minimumVersion();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String version() {
        return VERSION;
    }

    /**
     * Accepts regular files with a supported extension whose name parses and validates.
     * Symbolic links and anything below a {@code processed} folder are skipped.
     */
    @Override
    public boolean canHandle(Path file) {
        if (file == null || file.getFileName() == null) {
            return false;
        }
        if (Files.isSymbolicLink(file)) {
            return false;
        }
        if (isInsideProcessedFolder(file)) {
            return false;
        }
        String filename = file.getFileName().toString();
        if (!hasSupportedExtension(filename)) {
            return false;
        }
        return parseAndValidate(filename).isPresent();
    }

    /**
     * Verifies ExifTool is installed and recent enough. A successful check is remembered.
     */
    @Override
    public boolean initialize(Map<String, Object> config) {
        if (!toolVersionChecked) {
            try {
                double version = metadataWriter.toolVersion();
                if (version < minimumToolVersion) {
                    log.error("ExifTool version {} is too old. Minimum required version is {}",
                            version, minimumToolVersion);
                    return false;
                }
                log.info("ExifTool version {} detected", version);
                toolVersionChecked = true;
            } catch (MetadataWriteException ex) {
                log.error("ExifTool not found or not accessible: {}", ex.getMessage());
                log.error("Please install ExifTool from https://exiftool.org/ and ensure it's in your PATH");
                return false;
            }
        }
        log.info("{} plugin initialized successfully", NAME);
        return true;
    }

    @Override
    public boolean process(Path file, Map<String, Object> config) {
        if (file == null || file.getFileName() == null) {
            log.error("Cannot process {}: not a file path", file);
            return false;
        }
        log.info("Processing file: {}", file);
        String filename = file.getFileName().toString();

        // canHandle accepted the name already, parse again for the record
        Optional<ParsedFilename> parsed = parser.parse(filename);
        if (parsed.isEmpty()) {
            log.error("Failed to parse filename: {}", filename);
            return false;
        }

        List<Violation> violations = validator.validate(parsed.get());
        if (!violations.isEmpty()) {
            log.error("Invalid filename format: {}{}", filename, violations.stream()
                    .map(violation -> System.lineSeparator() + "  - " + violation.message())
                    .collect(Collectors.joining()));
            return false;
        }

        MetadataValues values = formatter.format(parsed.get());
        Map<String, String> tags = values.toTags();
        try {
            metadataWriter.write(file, tags);
        } catch (MetadataWriteException ex) {
            log.error("Failed to write metadata to {}", file, ex);
            return false;
        }
        log.info("  Metadata written to {}:", filename);
        tags.forEach((tag, value) -> log.info("    - {}: {}", tag, value));

        try {
            mover.moveToProcessed(file);
        } catch (FileRelocationException ex) {
            log.error("Failed to move file {} to {}/: {}", file, processedDirectoryName, ex.getMessage());
            return false;
        }

        log.info("Successfully processed: {}", filename);
        return true;
    }

    /**
     * Parses a bare filename and keeps it only when it has no violations.
     *
     * @param filename bare filename
     * @return valid record or empty
     */
    Optional<ParsedFilename> parseAndValidate(String filename) {
        return parser.parse(filename).filter(validator::isValid);
    }

    private boolean hasSupportedExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot >= 0 && supportedExtensions.contains(filename.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private boolean isInsideProcessedFolder(Path file) {
        Path parent = file.getParent();
        if (parent == null) {
            return false;
        }
        for (Path element : parent) {
            if (element.toString().equals(processedDirectoryName)) {
                return true;
            }
        }
        return false;
    }
}
