package com.adlanda.codecontext.model;

import java.time.Instant;
import java.util.List;

/**
 * File listing entry without the full content.
 */
public record SourceFileSummary(
        String id,
        String sessionId,
        String name,
        String language,
        int lines,
        int fragments,
        long embeddedFragments,
        List<String> dependencies,
        List<String> exports,
        Instant uploadedAt
) {
    public static SourceFileSummary from(SourceFile file) {
        return new SourceFileSummary(
                file.id(),
                file.sessionId(),
                file.name(),
                file.language(),
                file.lineCount(),
                file.fragments().size(),
                file.embeddedFragmentCount(),
                file.dependencies(),
                file.exports(),
                file.uploadedAt()
        );
    }
}
