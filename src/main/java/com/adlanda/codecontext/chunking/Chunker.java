package com.adlanda.codecontext.chunking;

import com.adlanda.codecontext.model.Fragment;
import com.adlanda.codecontext.model.FragmentKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Splits source text into structurally meaningful fragments.
 *
 * A single pass over the lines: a line matching one of the language's boundary
 * patterns closes the open fragment and opens a new one. Lines before the first
 * boundary become a leading fragment of kind OTHER. When no boundary is found the
 * whole file is one OTHER fragment, so every file has at least one fragment and
 * the fragments always partition [1, lineCount].
 */
@Component
public class Chunker {

    private static final String ID_PREFIX = "chunk_";

    /**
     * Splits content into fragments using the patterns of the given language.
     *
     * @param content  Full file text
     * @param language Language tag, unknown tags use generic patterns
     * @return Fragments in line order, never empty
     */
    public List<Fragment> chunk(String content, String language) {
        List<String> lines = SourceLines.split(content);
        LanguageFamily family = LanguageFamily.forLanguage(language);

        List<Fragment> fragments = new ArrayList<>();
        OpenFragment open = null;
        boolean boundaryFound = false;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;

            Optional<FragmentKind> boundary = family.boundaryAt(line.trim());
            if (boundary.isPresent()) {
                boundaryFound = true;
                if (open != null) {
                    fragments.add(open.close(lineNumber - 1));
                }
                open = new OpenFragment(ID_PREFIX + (fragments.size() + 1), lineNumber, boundary.get());
            } else if (open == null) {
                open = new OpenFragment(ID_PREFIX + 1, lineNumber, FragmentKind.OTHER);
            }
            open.append(line);
        }

        if (!boundaryFound) {
            return List.of(Fragment.withoutEmbedding(
                    ID_PREFIX + 1, content == null ? "" : content, 1, lines.size(), FragmentKind.OTHER));
        }

        fragments.add(open.close(lines.size()));
        return fragments;
    }

    /**
     * Modules imported by the file. Unrecognized syntax yields nothing.
     */
    public List<String> extractDependencies(String content, String language) {
        return captureAll(content, LanguageFamily.forLanguage(language).dependencyPatterns());
    }

    /**
     * Symbols exported by the file. Only module-based languages report exports.
     */
    public List<String> extractExports(String content, String language) {
        return captureAll(content, LanguageFamily.forLanguage(language).exportPatterns());
    }

    private List<String> captureAll(String content, List<CapturePattern> patterns) {
        if (patterns.isEmpty()) {
            return List.of();
        }
        Set<String> found = new LinkedHashSet<>();
        for (String line : SourceLines.split(content)) {
            String trimmed = line.trim();
            for (CapturePattern pattern : patterns) {
                pattern.capture(trimmed).ifPresent(found::add);
            }
        }
        return List.copyOf(found);
    }

    private static final class OpenFragment {

        private final String id;
        private final int startLine;
        private final FragmentKind kind;
        private final StringBuilder content = new StringBuilder();
        private boolean empty = true;

        OpenFragment(String id, int startLine, FragmentKind kind) {
            this.id = id;
            this.startLine = startLine;
            this.kind = kind;
        }

        void append(String line) {
            if (!empty) {
                content.append('\n');
            }
            content.append(line);
            empty = false;
        }

        Fragment close(int endLine) {
            return Fragment.withoutEmbedding(id, content.toString(), startLine, endLine, kind);
        }
    }
}
