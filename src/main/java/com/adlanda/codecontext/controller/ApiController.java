package com.adlanda.codecontext.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "Code Context Service",
                "version", appVersion,
                "endpoints", Map.of(
                        "files", "POST /api/v1/files - Register an uploaded source file",
                        "sessionFiles", "GET /api/v1/sessions/{sessionId}/files - List files of a session",
                        "sessionEmbeddings", "POST /api/v1/embeddings/sessions/{sessionId} - Embed all files of a session",
                        "fileEmbeddings", "POST /api/v1/embeddings/files/{fileId} - Embed a single file",
                        "search", "POST /api/v1/search - Semantic code search",
                        "context", "POST /api/v1/context - Build a prompt with project context",
                        "health", "GET /actuator/health - Health check"
                )
        ));
    }
}
