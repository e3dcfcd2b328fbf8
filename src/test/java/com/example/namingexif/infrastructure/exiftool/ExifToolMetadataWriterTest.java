package com.example.namingexif.infrastructure.exiftool;

import com.example.namingexif.config.TestProperties;
import com.example.namingexif.infrastructure.exception.MetadataWriteException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the ExifTool command line adapter. No ExifTool installation is required.
 */
class ExifToolMetadataWriterTest {

    @Test
    void buildsWriteCommandInTagOrder() {
        ExifToolMetadataWriter writer = new ExifToolMetadataWriter(TestProperties.defaults());
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("XMP-dc:Identifier", "abc");
        tags.put("EXIF:DateTimeOriginal", "1950:06:15 12:30:45");

        assertThat(writer.buildWriteCommand(Path.of("/watch/photo.jpg"), tags)).containsExactly(
                "exiftool",
                "-P",
                "-overwrite_original",
                "-XMP-dc:Identifier=abc",
                "-EXIF:DateTimeOriginal=1950:06:15 12:30:45",
                Path.of("/watch/photo.jpg").toString());
    }

    @Test
    void usesConfiguredCommand() {
        ExifToolMetadataWriter writer =
                new ExifToolMetadataWriter(TestProperties.withCommand(null, "/opt/exiftool/exiftool"));

        assertThat(writer.buildWriteCommand(Path.of("photo.jpg"), Map.of())).first().isEqualTo("/opt/exiftool/exiftool");
    }

    @Test
    void missingExecutableSurfacesAsMetadataWriteException() {
        ExifToolMetadataWriter writer =
                new ExifToolMetadataWriter(TestProperties.withCommand(null, "exiftool-not-installed-here"));

        assertThrows(MetadataWriteException.class, writer::toolVersion);
        assertThrows(MetadataWriteException.class, () -> writer.write(Path.of("photo.jpg"), Map.of("XMP-dc:Identifier", "abc")));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void readsVersionFromToolOutput(@TempDir Path folder) throws Exception {
        Path script = script(folder, "echo 12.50");
        ExifToolMetadataWriter writer = new ExifToolMetadataWriter(
                TestProperties.withTimeout(null, script.toString(), Duration.ofSeconds(10)));

        assertThat(writer.toolVersion()).isEqualTo(12.5);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void hungToolIsStoppedAtConfiguredTimeout(@TempDir Path folder) throws Exception {
        Path script = script(folder, "sleep 8", "echo 12.50");
        ExifToolMetadataWriter writer = new ExifToolMetadataWriter(
                TestProperties.withTimeout(null, script.toString(), Duration.ofSeconds(1)));

        long started = System.nanoTime();
        MetadataWriteException ex = assertThrows(MetadataWriteException.class, writer::toolVersion);
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertThat(ex.getMessage()).contains("did not finish within");
        assertThat(elapsedMillis).as("timeout is 1s").isLessThan(4000);
    }

    private static Path script(Path folder, String... lines) throws Exception {
        Path script = folder.resolve("fake-exiftool.sh");
        Files.writeString(script, "#!/bin/sh\n" + String.join("\n", lines) + "\n");
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script;
    }
}
