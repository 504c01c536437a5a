package com.adlanda.codecontext.model;

/**
 * Raw, length-bounded content of a file used when no fragment matched.
 *
 * @param name           File display name
 * @param language       Language tag
 * @param content        Content, truncated to the preview budget
 * @param fragmentCount  Number of fragments in the file
 * @param truncated      Whether the content was cut
 */
public record FilePreview(
        String name,
        String language,
        String content,
        int fragmentCount,
        boolean truncated
) {}
