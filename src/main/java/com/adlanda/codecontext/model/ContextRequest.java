package com.adlanda.codecontext.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for building a prompt with project context.
 * Without an API key the context is built without vector search.
 */
public record ContextRequest(
        @NotBlank(message = "Query is required")
        String query,

        @NotBlank(message = "Session ID is required")
        String sessionId,

        String apiKey
) {}
