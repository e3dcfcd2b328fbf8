package com.example.namingexif.application.plugin;

import java.nio.file.Path;
import java.util.Map;

/**
 * Contract between a folder-watching host and a file processor.
 * The host asks {@link #canHandle(Path)} for every new file and calls {@link #process(Path, Map)}
 * for the ones that are accepted. Failures are reported through return values so one bad file
 * never stops a batch.
 */
public interface FileProcessorPlugin {

    /**
     * @return unique plugin name
     */
    String name();

    /**
     * @return plugin version string
     */
    String version();

    /**
     * Cheap admission check; must not modify the file.
     *
     * @param file candidate file
     * @return {@code true} when {@link #process(Path, Map)} should be called for this file
     */
    boolean canHandle(Path file);

    /**
     * Prepares the plugin for processing.
     *
     * @param config plugin specific configuration
     * @return {@code true} when the plugin is ready
     */
    boolean initialize(Map<String, Object> config);

    /**
     * Processes one file.
     *
     * @param file   file previously accepted by {@link #canHandle(Path)}
     * @param config plugin specific configuration
     * @return {@code true} when the file was fully processed
     */
    boolean process(Path file, Map<String, Object> config);
}
