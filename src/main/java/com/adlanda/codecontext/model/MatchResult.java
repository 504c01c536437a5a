package com.adlanda.codecontext.model;

/**
 * Serializable view of a {@link RankedMatch}.
 */
public record MatchResult(
        String fileId,
        String fileName,
        String language,
        String fragmentId,
        String content,
        FragmentKind kind,
        int startLine,
        int endLine,
        double similarity
) {
    public static MatchResult from(RankedMatch match) {
        SourceFile file = match.file();
        Fragment fragment = match.fragment();
        return new MatchResult(
                file.id(),
                file.name(),
                file.language(),
                fragment.id(),
                fragment.content(),
                fragment.kind(),
                fragment.startLine(),
                fragment.endLine(),
                match.similarity()
        );
    }
}
