package com.adlanda.codecontext.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for the semantic search endpoint.
 */
public record SearchRequest(
        @NotBlank(message = "Query is required")
        String query,

        @NotBlank(message = "Session ID is required")
        String sessionId,

        @NotBlank(message = "API key is required")
        String apiKey,

        @Min(1) @Max(20)
        Integer limit
) {
    public SearchRequest {
        if (limit == null) {
            limit = 5;
        }
    }
}
