package com.adlanda.codecontext.model;

import java.util.List;

/**
 * Overview of the files available to a session.
 *
 * @param totalFiles  Number of files
 * @param languages   Distinct language tags in first-seen order
 * @param totalLines  Sum of line counts across all files
 * @param mainFiles   Names of files that look like entry points
 */
public record ProjectSummary(
        int totalFiles,
        List<String> languages,
        int totalLines,
        List<String> mainFiles
) {
    public ProjectSummary {
        languages = List.copyOf(languages);
        mainFiles = List.copyOf(mainFiles);
    }

    public static ProjectSummary empty() {
        return new ProjectSummary(0, List.of(), 0, List.of());
    }
}
