package com.example.namingexif.application.plugin;

import com.example.namingexif.config.TestProperties;
import com.example.namingexif.domain.model.ParsedFilename;
import com.example.namingexif.domain.naming.FilenameParser;
import com.example.namingexif.domain.naming.FilenameValidator;
import com.example.namingexif.domain.naming.MetadataFormatter;
import com.example.namingexif.infrastructure.exception.MetadataWriteException;
import com.example.namingexif.infrastructure.exception.ProcessedFileExistsException;
import com.example.namingexif.infrastructure.exiftool.MetadataWriter;
import com.example.namingexif.infrastructure.fs.ProcessedFolderMover;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the plugin admission check, initialization and processing flow.
 */
class PhotoNamingExifPluginTest {

    private static final String EXACT = "1950.06.15.12.30.00.E.FAM.POR.000001.tiff";

    private MetadataWriter metadataWriter;
    private ProcessedFolderMover mover;
    private PhotoNamingExifPlugin plugin;

    @BeforeEach
    void setUp() {
        metadataWriter = mock(MetadataWriter.class);
        mover = mock(ProcessedFolderMover.class);
        plugin = newPlugin(mover);
    }

    @Test
    void exposesNameAndVersion() {
        assertThat(plugin.name()).isEqualTo("naming_exif");
        assertThat(plugin.version()).isEqualTo("0.1.0");
    }

    @Test
    void canHandleAcceptsValidNamesWithSupportedExtensions() {
        assertThat(plugin.canHandle(Path.of("1950.06.15.12.00.00.E.FAM.POR.000001.tiff"))).isTrue();
        assertThat(plugin.canHandle(Path.of("1950.06.00.00.00.00.C.FAM.POR.000002.jpg"))).isTrue();
        for (String extension : List.of("tiff", "tif", "jpg", "jpeg", "TIFF", "JPG")) {
            assertThat(plugin.canHandle(Path.of("1950.06.15.12.00.00.E.FAM.POR.000001." + extension)))
                    .as("extension %s", extension)
                    .isTrue();
        }
    }

    @Test
    void canHandleRejectsUnsupportedOrInvalidNames() {
        assertThat(plugin.canHandle(Path.of("1950.06.15.12.00.00.E.FAM.POR.000001.png"))).isFalse();
        assertThat(plugin.canHandle(Path.of("invalid.jpg"))).isFalse();
        assertThat(plugin.canHandle(Path.of("1950.13.15.00.00.00.E.FAM.POR.000001.tiff"))).isFalse();
        assertThat(plugin.canHandle(Path.of("README"))).isFalse();
        assertThat(plugin.canHandle(null)).isFalse();
    }

    @Test
    void canHandleSkipsProcessedFolders() {
        assertThat(plugin.canHandle(Path.of("/watch/" + EXACT))).isTrue();
        assertThat(plugin.canHandle(Path.of("/watch/processed/" + EXACT))).isFalse();
        assertThat(plugin.canHandle(Path.of("/watch/subfolder/processed/" + EXACT))).isFalse();
        assertThat(plugin.canHandle(Path.of("/watch/processed/subfolder/" + EXACT))).isFalse();
    }

    @Test
    void canHandleAcceptsFoldersWithSimilarNames() {
        assertThat(plugin.canHandle(Path.of("/watch/my_processed_files/" + EXACT))).isTrue();
        assertThat(plugin.canHandle(Path.of("/watch/not_processed/" + EXACT))).isTrue();
        assertThat(plugin.canHandle(Path.of("/watch/preprocessed/" + EXACT))).isTrue();
    }

    @Test
    void canHandleSkipsSymbolicLinks(@TempDir Path folder) throws Exception {
        Path target = Files.createFile(folder.resolve("target.bin"));
        Path link = Files.createSymbolicLink(folder.resolve(EXACT), target);

        assertThat(plugin.canHandle(link)).isFalse();
    }

    @Test
    void parseAndValidateReturnsOnlyValidRecords() {
        assertThat(plugin.parseAndValidate(EXACT)).get().extracting(ParsedFilename::year).isEqualTo(1950);
        assertThat(plugin.parseAndValidate("invalid.jpg")).isEmpty();
        assertThat(plugin.parseAndValidate("1950.13.15.00.00.00.E.FAM.POR.000001.tiff")).isEmpty();
    }

    @Test
    void initializeAcceptsRecentExifToolAndRemembersIt() {
        when(metadataWriter.toolVersion()).thenReturn(12.76);

        assertThat(plugin.initialize(Map.of())).isTrue();
        assertThat(plugin.initialize(Map.of())).isTrue();
        verify(metadataWriter, times(1)).toolVersion();
    }

    @Test
    void initializeRejectsOldExifTool() {
        when(metadataWriter.toolVersion()).thenReturn(10.8);

        assertThat(plugin.initialize(Map.of())).isFalse();
    }

    @Test
    void initializeFailsWhenExifToolIsMissing() {
        when(metadataWriter.toolVersion()).thenThrow(new MetadataWriteException("Unable to start ExifTool (exiftool)"));

        assertThat(plugin.initialize(Map.of())).isFalse();
        assertThat(plugin.initialize(Map.of())).isFalse();
        verify(metadataWriter, times(2)).toolVersion();
    }

    @Test
    @SuppressWarnings("unchecked")
    void processWritesExactDateTagsAndMovesFile() {
        Path file = Path.of("/watch/" + EXACT);

        assertThat(plugin.process(file, Map.of())).isTrue();

        ArgumentCaptor<Map<String, String>> tags = ArgumentCaptor.forClass(Map.class);
        verify(metadataWriter).write(eq(file), tags.capture());
        assertThat(tags.getValue())
                .containsEntry("EXIF:DateTimeOriginal", "1950:06:15 12:30:00")
                .containsEntry("XMP-dc:Date", "1950-06-15")
                .containsEntry("XMP-photoshop:DateCreated", "1950-06-15T12:30:00");
        assertThat(tags.getValue().get("XMP-dc:Identifier"))
                .isNotBlank()
                .isEqualTo(tags.getValue().get("XMP-xmpMM:DocumentID"));
        verify(mover).moveToProcessed(file);
    }

    @Test
    @SuppressWarnings("unchecked")
    void processSkipsTimestampsForCircaDates() {
        Path file = Path.of("/watch/1950.06.00.00.00.00.C.FAM.POR.000002.jpg");

        assertThat(plugin.process(file, Map.of())).isTrue();

        ArgumentCaptor<Map<String, String>> tags = ArgumentCaptor.forClass(Map.class);
        verify(metadataWriter).write(eq(file), tags.capture());
        assertThat(tags.getValue())
                .containsEntry("XMP-dc:Date", "1950-06")
                .doesNotContainKeys("EXIF:DateTimeOriginal", "XMP-photoshop:DateCreated");
    }

    @Test
    void processRejectsUnparseableAndInvalidNames() {
        assertThat(plugin.process(Path.of("/watch/invalid.jpg"), Map.of())).isFalse();
        assertThat(plugin.process(Path.of("/watch/1950.02.30.00.00.00.E.FAM.POR.000002.tiff"), Map.of())).isFalse();

        verifyNoInteractions(metadataWriter, mover);
    }

    @Test
    void processRejectsPathsWithoutFileName() {
        assertThat(plugin.process(Path.of("/"), Map.of())).isFalse();
        assertThat(plugin.process(null, Map.of())).isFalse();

        verifyNoInteractions(metadataWriter, mover);
    }

    @Test
    void processStopsWhenMetadataCannotBeWritten() {
        doThrow(new MetadataWriteException("ExifTool exited with code 1"))
                .when(metadataWriter).write(any(), anyMap());

        assertThat(plugin.process(Path.of("/watch/" + EXACT), Map.of())).isFalse();
        verify(mover, never()).moveToProcessed(any());
    }

    @Test
    void processFailsWhenFileWasAlreadyProcessed() {
        Path file = Path.of("/watch/" + EXACT);
        when(mover.moveToProcessed(file)).thenThrow(new ProcessedFileExistsException(Path.of("/watch/processed/" + EXACT)));

        assertThat(plugin.process(file, Map.of())).isFalse();
    }

    @Test
    void processMovesFileIntoSiblingProcessedFolder(@TempDir Path folder) throws Exception {
        PhotoNamingExifPlugin realMover = newPlugin(new ProcessedFolderMover(TestProperties.defaults()));
        Path file = Files.writeString(folder.resolve(EXACT), "image");

        assertThat(realMover.process(file, Map.of())).isTrue();

        assertThat(file).doesNotExist();
        assertThat(folder.resolve("processed").resolve(EXACT)).hasContent("image");
        assertThat(realMover.canHandle(folder.resolve("processed").resolve(EXACT))).isFalse();
    }

    private PhotoNamingExifPlugin newPlugin(ProcessedFolderMover folderMover) {
        return new PhotoNamingExifPlugin(
                new FilenameParser(),
                new FilenameValidator(),
                new MetadataFormatter(),
                metadataWriter,
                folderMover,
                TestProperties.defaults()
        );
    }
}
