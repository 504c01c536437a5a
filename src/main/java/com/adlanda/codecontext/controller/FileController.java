package com.adlanda.codecontext.controller;

import com.adlanda.codecontext.model.FileUploadRequest;
import com.adlanda.codecontext.model.SourceFile;
import com.adlanda.codecontext.model.SourceFileSummary;
import com.adlanda.codecontext.service.SourceFileService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for registering and listing uploaded source files.
 */
@RestController
@RequestMapping("/api/v1")
public class FileController {

    private final SourceFileService sourceFileService;

    public FileController(SourceFileService sourceFileService) {
        this.sourceFileService = sourceFileService;
    }

    @PostMapping("/files")
    public ResponseEntity<SourceFileSummary> register(@Valid @RequestBody FileUploadRequest request) {
        SourceFile file = sourceFileService.register(request.sessionId(), request.name(), request.content());
        return ResponseEntity.status(HttpStatus.CREATED).body(SourceFileSummary.from(file));
    }

    @GetMapping("/sessions/{sessionId}/files")
    public ResponseEntity<List<SourceFileSummary>> list(@PathVariable String sessionId) {
        return ResponseEntity.ok(sourceFileService.listFiles(sessionId).stream()
                .map(SourceFileSummary::from)
                .toList());
    }
}
