package com.adlanda.codecontext.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request body for registering an uploaded source file.
 * The session may be absent when files are uploaded before a chat session exists.
 */
public record FileUploadRequest(
        @NotBlank(message = "File name is required")
        String name,

        @NotNull(message = "Content is required")
        String content,

        String sessionId
) {}
