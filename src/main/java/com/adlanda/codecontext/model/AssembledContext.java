package com.adlanda.codecontext.model;

import java.util.List;

/**
 * Context gathered for a single query. Built fresh per query and never persisted.
 *
 * @param query     The original user query
 * @param summary   Project overview
 * @param matches   Ranked fragments, similarity rounded for presentation
 * @param previews  Raw file previews
 */
public record AssembledContext(
        String query,
        ProjectSummary summary,
        List<RankedMatch> matches,
        List<FilePreview> previews
) {
    public AssembledContext {
        matches = List.copyOf(matches);
        previews = List.copyOf(previews);
    }

    public static AssembledContext empty(String query) {
        return new AssembledContext(query, ProjectSummary.empty(), List.of(), List.of());
    }

    public boolean hasFiles() {
        return summary.totalFiles() > 0;
    }
}
