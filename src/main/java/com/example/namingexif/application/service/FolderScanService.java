package com.example.namingexif.application.service;

import com.example.namingexif.application.exception.PluginInitializationException;
import com.example.namingexif.application.exception.UseCaseValidationException;
import com.example.namingexif.application.plugin.FileProcessorPlugin;
import com.example.namingexif.config.NamingExifProperties;
import com.example.namingexif.domain.exception.WatchFolderNotFoundException;
import com.example.namingexif.domain.model.ScanReport;
import com.example.namingexif.infrastructure.exception.FolderScanException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Application-layer service that runs the plugin over every file directly inside a folder.
 * Files are handled one after another; a failing file is recorded and the scan moves on.
 */
@Service
public class FolderScanService {

    private static final Logger log = LoggerFactory.getLogger(FolderScanService.class);

    private final FileProcessorPlugin plugin;
    private final Path defaultFolder;

    public FolderScanService(FileProcessorPlugin plugin, NamingExifProperties properties) {
        this.plugin = plugin;
        this.defaultFolder = properties.watchFolder();
    }

    /**
     * Scans the given folder, or the configured watch folder when none is given.
     *
     * @param folder folder to scan, may be {@code null}
     * @return what happened to each file
     * @throws UseCaseValidationException    when neither a folder nor a watch folder is available
     * @throws WatchFolderNotFoundException  when the folder is not a directory
     * @throws PluginInitializationException when the plugin is not ready
     * @throws FolderScanException           when the folder cannot be listed
     */
    public ScanReport scan(Path folder) {
        Path target = folder != null ? folder : defaultFolder;
        if (target == null) {
            throw new UseCaseValidationException("A folder path is required when no watch folder is configured.");
        }
        if (!Files.isDirectory(target)) {
            throw new WatchFolderNotFoundException(target.toAbsolutePath().toString());
        }
        if (!plugin.initialize(Map.of())) {
            throw new PluginInitializationException(plugin.name());
        }

        List<Path> candidates;
        try (Stream<Path> files = Files.list(target)) {
            candidates = files.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException ex) {
            throw new FolderScanException("Unable to list " + target, ex);
        }

        List<String> processed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (Path file : candidates) {
            String name = file.getFileName().toString();
            if (!plugin.canHandle(file)) {
                log.debug("Skipping {}", name);
                skipped.add(name);
            } else if (plugin.process(file, Map.of())) {
                processed.add(name);
            } else {
                log.warn("Processing failed for {}", name);
                failed.add(name);
            }
        }

        log.info("Scan of {} finished: {} processed, {} skipped, {} failed",
                target, processed.size(), skipped.size(), failed.size());
        return new ScanReport(target.toString(), processed, skipped, failed);
    }
}
