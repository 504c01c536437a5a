package com.adlanda.codecontext.controller;

import com.adlanda.codecontext.embedding.EmbeddingProvider;
import com.adlanda.codecontext.embedding.EmbeddingProviderFactory;
import com.adlanda.codecontext.embedding.ProviderException;
import com.adlanda.codecontext.model.AssembledContext;
import com.adlanda.codecontext.model.ContextRequest;
import com.adlanda.codecontext.model.ContextResponse;
import com.adlanda.codecontext.model.SearchRequest;
import com.adlanda.codecontext.model.SearchResponse;
import com.adlanda.codecontext.service.ContextAssembler;
import com.adlanda.codecontext.service.SemanticSearchService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for semantic search and prompt construction.
 */
@RestController
@RequestMapping("/api/v1")
public class SearchController {

    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    private final SemanticSearchService searchService;
    private final ContextAssembler contextAssembler;
    private final EmbeddingProviderFactory providerFactory;

    public SearchController(SemanticSearchService searchService,
                            ContextAssembler contextAssembler,
                            EmbeddingProviderFactory providerFactory) {
        this.searchService = searchService;
        this.contextAssembler = contextAssembler;
        this.providerFactory = providerFactory;
    }

    /**
     * Semantic search over the fragments of a session.
     */
    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        EmbeddingProvider provider = providerFactory.create(request.apiKey());
        return ResponseEntity.ok(searchService.search(
                request.query(), request.sessionId(), provider, request.limit()));
    }

    /**
     * Builds the prompt for a chat message. Never fails because of embeddings:
     * without a usable provider the prompt is built without code matches.
     */
    @PostMapping("/context")
    public ResponseEntity<ContextResponse> context(@Valid @RequestBody ContextRequest request) {
        AssembledContext context = contextAssembler.buildContext(
                request.query(), request.sessionId(), providerFor(request.apiKey()));
        String prompt = contextAssembler.buildPrompt(request.query(), context);
        return ResponseEntity.ok(ContextResponse.from(prompt, context));
    }

    private EmbeddingProvider providerFor(String apiKey) {
        if (!StringUtils.hasText(apiKey)) {
            return null;
        }
        try {
            return providerFactory.create(apiKey);
        } catch (ProviderException e) {
            log.warn("Could not create embedding provider, continuing without vector search: {}", e.getMessage());
            return null;
        }
    }
}
