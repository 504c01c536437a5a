package com.adlanda.codecontext.chunking;

import com.adlanda.codecontext.model.FragmentKind;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Languages the chunker knows how to split, each with its own ordered patterns.
 *
 * Boundary patterns are tried in declaration order and the first match wins.
 * Patterns are applied to trimmed lines.
 */
public enum LanguageFamily {

    TYPESCRIPT(
            Set.of("typescript", "javascript"),
            List.of(
                    BoundaryPattern.of("^(export\\s+)?(default\\s+)?(async\\s+)?function\\*?\\s+\\w+", FragmentKind.FUNCTION),
                    BoundaryPattern.of("^(export\\s+)?(default\\s+)?(abstract\\s+)?class\\s+\\w+", FragmentKind.CLASS),
                    BoundaryPattern.of("^(export\\s+)?interface\\s+\\w+", FragmentKind.INTERFACE),
                    BoundaryPattern.of("^(export\\s+)?type\\s+\\w+", FragmentKind.INTERFACE),
                    BoundaryPattern.of("^(export\\s+)?const\\s+\\w+\\s*=\\s*(async\\s+)?\\(", FragmentKind.FUNCTION)
            ),
            List.of(
                    CapturePattern.of("^import\\s.*from\\s+['\"]([^'\"]+)['\"]", 1),
                    CapturePattern.of("^import\\s+['\"]([^'\"]+)['\"]", 1),
                    CapturePattern.of("require\\(['\"]([^'\"]+)['\"]\\)", 1)
            ),
            List.of(
                    CapturePattern.of("^export\\s+(?:async\\s+)?(?:function|class|interface|type|const|let|var)\\s+([^\\s(<:=]+)", 1),
                    CapturePattern.of("^export\\s+default\\s+(?:(?:async\\s+)?function\\s+|class\\s+)?([A-Za-z_$][\\w$]*)", 1)
            )
    ),

    PYTHON(
            Set.of("python"),
            List.of(
                    BoundaryPattern.of("^(async\\s+)?def\\s+\\w+", FragmentKind.FUNCTION),
                    BoundaryPattern.of("^class\\s+\\w+", FragmentKind.CLASS)
            ),
            List.of(
                    CapturePattern.of("^(?:import|from)\\s+([^\\s,]+)", 1)
            ),
            List.of()
    ),

    JAVA(
            Set.of("java"),
            List.of(
                    BoundaryPattern.of("^((public|private|protected)\\s+)?((abstract|final|static|sealed)\\s+)*(class|enum|record)\\s+\\w+", FragmentKind.CLASS),
                    BoundaryPattern.of("^((public|private|protected)\\s+)?((abstract|sealed|static)\\s+)*@?interface\\s+\\w+", FragmentKind.INTERFACE),
                    BoundaryPattern.of("^(?!(?:if|for|while|switch|catch|synchronized|return|new|else|do|try)\\b)"
                            + "((public|private|protected)\\s+)?(static\\s+)?([\\w<>\\[\\],?.]+\\s+)*\\w+\\s*\\([^)]*\\)"
                            + "(\\s*throws\\s+[\\w.,\\s]+)?\\s*\\{", FragmentKind.FUNCTION)
            ),
            List.of(
                    CapturePattern.of("^import\\s+(?:static\\s+)?([^;\\s]+)\\s*;", 1)
            ),
            List.of()
    ),

    C_FAMILY(
            Set.of("c", "cpp"),
            List.of(
                    BoundaryPattern.of("^(?!(?:if|for|while|switch|return|else|do)\\b)([\\w*&:<>]+\\s+)*[\\w*&:~]+\\s*\\([^)]*\\)\\s*(const\\s*)?\\{", FragmentKind.FUNCTION),
                    BoundaryPattern.of("^(class|struct)\\s+\\w+", FragmentKind.CLASS)
            ),
            List.of(),
            List.of()
    ),

    GENERIC(
            Set.of(),
            List.of(
                    BoundaryPattern.of("^(function|def|fn)\\s+\\w+", FragmentKind.FUNCTION),
                    BoundaryPattern.of("^(class|struct|type)\\s+\\w+", FragmentKind.CLASS)
            ),
            List.of(),
            List.of()
    );

    private final Set<String> languageTags;
    private final List<BoundaryPattern> boundaries;
    private final List<CapturePattern> dependencies;
    private final List<CapturePattern> exports;

    LanguageFamily(Set<String> languageTags,
                   List<BoundaryPattern> boundaries,
                   List<CapturePattern> dependencies,
                   List<CapturePattern> exports) {
        this.languageTags = languageTags;
        this.boundaries = boundaries;
        this.dependencies = dependencies;
        this.exports = exports;
    }

    /**
     * Selects the family for a language tag, falling back to {@link #GENERIC}.
     */
    public static LanguageFamily forLanguage(String language) {
        if (language == null) {
            return GENERIC;
        }
        String tag = language.trim().toLowerCase(Locale.ROOT);
        for (LanguageFamily family : values()) {
            if (family.languageTags.contains(tag)) {
                return family;
            }
        }
        return GENERIC;
    }

    /**
     * Kind of the first boundary pattern matching the line, if any.
     */
    Optional<FragmentKind> boundaryAt(String trimmedLine) {
        for (BoundaryPattern pattern : boundaries) {
            if (pattern.matches(trimmedLine)) {
                return Optional.of(pattern.kind());
            }
        }
        return Optional.empty();
    }

    List<CapturePattern> dependencyPatterns() {
        return dependencies;
    }

    List<CapturePattern> exportPatterns() {
        return exports;
    }
}
