package com.adlanda.codecontext.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for embedding generation endpoints.
 */
public record EmbeddingRequest(
        @NotBlank(message = "API key is required")
        String apiKey
) {}
