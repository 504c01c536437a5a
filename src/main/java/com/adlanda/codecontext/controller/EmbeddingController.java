package com.adlanda.codecontext.controller;

import com.adlanda.codecontext.embedding.EmbeddingProvider;
import com.adlanda.codecontext.embedding.EmbeddingProviderFactory;
import com.adlanda.codecontext.model.EmbeddingRequest;
import com.adlanda.codecontext.model.EmbeddingRunSummary;
import com.adlanda.codecontext.service.EmbeddingService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for on-demand embedding generation.
 */
@RestController
@RequestMapping("/api/v1/embeddings")
public class EmbeddingController {

    private final EmbeddingService embeddingService;
    private final EmbeddingProviderFactory providerFactory;

    public EmbeddingController(EmbeddingService embeddingService, EmbeddingProviderFactory providerFactory) {
        this.embeddingService = embeddingService;
        this.providerFactory = providerFactory;
    }

    @PostMapping("/sessions/{sessionId}")
    public ResponseEntity<EmbeddingRunSummary> embedSession(@PathVariable String sessionId,
                                                            @Valid @RequestBody EmbeddingRequest request) {
        EmbeddingProvider provider = providerFactory.create(request.apiKey());
        return ResponseEntity.ok(embeddingService.generateEmbeddingsForSession(sessionId, provider));
    }

    @PostMapping("/files/{fileId}")
    public ResponseEntity<Map<String, Object>> embedFile(@PathVariable String fileId,
                                                         @Valid @RequestBody EmbeddingRequest request) {
        EmbeddingProvider provider = providerFactory.create(request.apiKey());
        int embedded = embeddingService.generateEmbeddingsForFile(fileId, provider);
        return ResponseEntity.ok(Map.of(
                "fileId", fileId,
                "embeddings", embedded,
                "message", "Generated " + embedded + " embeddings for file"
        ));
    }
}
