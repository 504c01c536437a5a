package com.adlanda.codecontext.model;

import java.util.List;

/**
 * Rendered prompt plus the structured context it was built from.
 */
public record ContextResponse(
        String prompt,
        ProjectSummary summary,
        List<MatchResult> matches,
        List<String> previewedFiles
) {
    public static ContextResponse from(String prompt, AssembledContext context) {
        return new ContextResponse(
                prompt,
                context.summary(),
                context.matches().stream().map(MatchResult::from).toList(),
                context.previews().stream().map(FilePreview::name).toList()
        );
    }
}
