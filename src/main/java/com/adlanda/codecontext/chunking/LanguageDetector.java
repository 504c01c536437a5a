package com.adlanda.codecontext.chunking;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps uploaded file names to language tags and filters out files that never
 * belong in a code context (dependencies, build output, secrets, logs).
 */
@Component
public class LanguageDetector {

    public static final String DEFAULT_LANGUAGE = "text";

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry(".ts", "typescript"),
            Map.entry(".tsx", "typescript"),
            Map.entry(".js", "javascript"),
            Map.entry(".jsx", "javascript"),
            Map.entry(".py", "python"),
            Map.entry(".java", "java"),
            Map.entry(".cpp", "cpp"),
            Map.entry(".hpp", "cpp"),
            Map.entry(".c", "c"),
            Map.entry(".h", "c"),
            Map.entry(".go", "go"),
            Map.entry(".rs", "rust"),
            Map.entry(".php", "php"),
            Map.entry(".rb", "ruby"),
            Map.entry(".cs", "csharp"),
            Map.entry(".swift", "swift"),
            Map.entry(".kt", "kotlin"),
            Map.entry(".scala", "scala"),
            Map.entry(".html", "html"),
            Map.entry(".css", "css"),
            Map.entry(".scss", "scss"),
            Map.entry(".less", "less"),
            Map.entry(".json", "json"),
            Map.entry(".xml", "xml"),
            Map.entry(".yml", "yaml"),
            Map.entry(".yaml", "yaml"),
            Map.entry(".md", "markdown"),
            Map.entry(".txt", "text"),
            Map.entry(".sh", "bash"),
            Map.entry(".sql", "sql")
    );

    private static final List<Pattern> EXCLUDED = List.of(
            Pattern.compile("node_modules"),
            Pattern.compile("\\.git(/|$)"),
            Pattern.compile("\\.DS_Store"),
            Pattern.compile("\\.env"),
            Pattern.compile("\\.log$"),
            Pattern.compile("\\.tmp$"),
            Pattern.compile("\\.cache"),
            Pattern.compile("(^|/)dist/"),
            Pattern.compile("(^|/)build/"),
            Pattern.compile("(^|/)coverage/"),
            Pattern.compile("\\.nyc_output")
    );

    /**
     * Language tag for the file's extension, "text" when unknown.
     */
    public String detect(String fileName) {
        if (fileName == null) {
            return DEFAULT_LANGUAGE;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        if (dot < 0 || dot < lower.lastIndexOf('/')) {
            return DEFAULT_LANGUAGE;
        }
        return LANGUAGES.getOrDefault(lower.substring(dot), DEFAULT_LANGUAGE);
    }

    public boolean isExcluded(String fileName) {
        String normalized = fileName.replace('\\', '/');
        return EXCLUDED.stream().anyMatch(p -> p.matcher(normalized).find());
    }
}
