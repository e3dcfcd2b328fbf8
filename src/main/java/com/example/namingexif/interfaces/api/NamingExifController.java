package com.example.namingexif.interfaces.api;

import com.example.namingexif.application.service.FilenameInspectionService;
import com.example.namingexif.application.service.FolderScanService;
import com.example.namingexif.domain.model.FilenameInspection;
import com.example.namingexif.domain.model.ScanReport;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;

/**
 * Interfaces-layer REST controller for inspecting filenames and triggering folder scans.
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class NamingExifController {

    private final FilenameInspectionService inspectionService;
    private final FolderScanService folderScanService;

    /**
     * Creates the controller with the required application services.
     *
     * @param inspectionService service that parses and validates names
     * @param folderScanService service that runs the plugin over a folder
     */
    public NamingExifController(FilenameInspectionService inspectionService, FolderScanService folderScanService) {
        this.inspectionService = inspectionService;
        this.folderScanService = folderScanService;
    }

    /**
     * Explains how a filename would be parsed, validated and tagged.
     *
     * @param name bare filename
     * @return inspection result
     */
    @GetMapping("/filenames/inspect")
    public ResponseEntity<FilenameInspection> inspect(@RequestParam("name") String name) {
        return ResponseEntity.ok(inspectionService.inspect(name));
    }

    /**
     * Processes every eligible file in a folder.
     *
     * @param path folder to scan; the configured watch folder is used when omitted
     * @return scan report
     */
    @PostMapping("/scan")
    public ResponseEntity<ScanReport> scan(@RequestParam(value = "path", required = false) String path) {
        Path folder = path == null || path.isBlank() ? null : Path.of(path);
        return ResponseEntity.ok(folderScanService.scan(folder));
    }
}
