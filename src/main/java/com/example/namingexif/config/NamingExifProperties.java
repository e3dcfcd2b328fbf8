package com.example.namingexif.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Externalized settings bound from the {@code naming-exif.*} namespace.
 *
 * @param processedDirectoryName name of the sibling folder that receives processed files
 * @param supportedExtensions    lowercase extensions the plugin accepts, without the dot
 * @param watchFolder            default folder for scans, may be {@code null}
 * @param exiftool               ExifTool process settings
 */
@ConfigurationProperties(prefix = "naming-exif")
public record NamingExifProperties(
        @DefaultValue("processed") String processedDirectoryName,
        @DefaultValue({"tiff", "tif", "jpg", "jpeg"}) List<String> supportedExtensions,
        Path watchFolder,
        @DefaultValue ExifTool exiftool
) {

    /**
     * @param command        executable name or absolute path
     * @param minimumVersion oldest ExifTool release accepted by {@code initialize}
     * @param timeout        how long a single ExifTool invocation may run
     */
    public record ExifTool(
            @DefaultValue("exiftool") String command,
            @DefaultValue("11.0") double minimumVersion,
            @DefaultValue("30s") Duration timeout
    ) {
    }
}
