package com.example.namingexif.domain.model;

import java.util.List;

/**
 * Outcome of one pass over a watch folder, grouped by what happened to each file name.
 *
 * @param folder    folder that was scanned
 * @param processed files whose metadata was written and that were moved to the processed folder
 * @param skipped   files the plugin declined to handle
 * @param failed    files the plugin accepted but could not process
 */
public record ScanReport(
        String folder,
        List<String> processed,
        List<String> skipped,
        List<String> failed
) {

    public ScanReport {
        processed = List.copyOf(processed);
        skipped = List.copyOf(skipped);
        failed = List.copyOf(failed);
    }
}
