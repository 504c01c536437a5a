package com.adlanda.codecontext.model;

import com.adlanda.codecontext.chunking.SourceLines;

import java.time.Instant;
import java.util.List;

/**
 * An uploaded source file together with its fragments.
 *
 * @param id            Unique identifier
 * @param sessionId     Owning chat session, null while unassigned
 * @param name          Display name as uploaded
 * @param language      Detected language tag
 * @param content       Full text content
 * @param fragments     Fragments in line order
 * @param dependencies  Imported modules, best effort
 * @param exports       Exported symbols, best effort
 * @param uploadedAt    Upload timestamp
 */
public record SourceFile(
        String id,
        String sessionId,
        String name,
        String language,
        String content,
        List<Fragment> fragments,
        List<String> dependencies,
        List<String> exports,
        Instant uploadedAt
) {
    public SourceFile {
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        exports = exports == null ? List.of() : List.copyOf(exports);
    }

    /**
     * Creates a copy of this file with the given fragments.
     */
    public SourceFile withFragments(List<Fragment> updated) {
        return new SourceFile(id, sessionId, name, language, content, updated, dependencies, exports, uploadedAt);
    }

    public int lineCount() {
        return SourceLines.count(content);
    }

    public long embeddedFragmentCount() {
        return fragments.stream().filter(Fragment::hasEmbedding).count();
    }
}
