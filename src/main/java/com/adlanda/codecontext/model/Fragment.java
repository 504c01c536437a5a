package com.adlanda.codecontext.model;

/**
 * A structurally meaningful slice of a source file, the unit of retrieval.
 *
 * @param id         Identifier unique within the owning file
 * @param content    The literal text of the lines in this fragment
 * @param startLine  First line, 1-based
 * @param endLine    Last line, 1-based and inclusive
 * @param kind       Structural kind detected at the first line
 * @param embedding  Vector representation, null until generated
 */
public record Fragment(
        String id,
        String content,
        int startLine,
        int endLine,
        FragmentKind kind,
        EmbeddingVector embedding
) {
    /**
     * Creates a fragment before any embedding has been generated.
     */
    public static Fragment withoutEmbedding(String id, String content, int startLine, int endLine, FragmentKind kind) {
        return new Fragment(id, content, startLine, endLine, kind, null);
    }

    /**
     * Creates a copy of this fragment carrying the given embedding.
     */
    public Fragment withEmbedding(EmbeddingVector embedding) {
        return new Fragment(id, content, startLine, endLine, kind, embedding);
    }

    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }

    /**
     * Line range rendered as "start-end".
     */
    public String lines() {
        return startLine + "-" + endLine;
    }
}
