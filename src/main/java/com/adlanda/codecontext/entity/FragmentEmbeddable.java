package com.adlanda.codecontext.entity;

import com.adlanda.codecontext.model.EmbeddingVector;
import com.adlanda.codecontext.model.Fragment;
import com.adlanda.codecontext.model.FragmentKind;
import jakarta.persistence.*;

/**
 * Persisted form of a fragment, stored in the file's fragment collection.
 */
@Embeddable
public class FragmentEmbeddable {

    @Column(name = "fragment_id", nullable = false, length = 64)
    private String fragmentId;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "start_line", nullable = false)
    private int startLine;

    @Column(name = "end_line", nullable = false)
    private int endLine;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16)
    private FragmentKind kind;

    @Convert(converter = EmbeddingVectorConverter.class)
    @Column(name = "embedding", columnDefinition = "TEXT")
    private EmbeddingVector embedding;

    // Default constructor for JPA
    protected FragmentEmbeddable() {
    }

    public static FragmentEmbeddable from(Fragment fragment) {
        FragmentEmbeddable embeddable = new FragmentEmbeddable();
        embeddable.fragmentId = fragment.id();
        embeddable.content = fragment.content();
        embeddable.startLine = fragment.startLine();
        embeddable.endLine = fragment.endLine();
        embeddable.kind = fragment.kind();
        embeddable.embedding = fragment.embedding();
        return embeddable;
    }

    public Fragment toFragment() {
        return new Fragment(fragmentId, content, startLine, endLine, kind, embedding);
    }
}
