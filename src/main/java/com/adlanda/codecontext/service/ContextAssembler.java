package com.adlanda.codecontext.service;

import com.adlanda.codecontext.config.ContextProperties;
import com.adlanda.codecontext.embedding.EmbeddingProvider;
import com.adlanda.codecontext.model.AssembledContext;
import com.adlanda.codecontext.model.EmbeddingVector;
import com.adlanda.codecontext.model.FilePreview;
import com.adlanda.codecontext.model.Fragment;
import com.adlanda.codecontext.model.ProjectSummary;
import com.adlanda.codecontext.model.RankedMatch;
import com.adlanda.codecontext.model.SourceFile;
import com.adlanda.codecontext.repository.SourceFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Service responsible for building the project context handed to the language model.
 *
 * Orchestrates the query flow:
 * 1. Resolve the session's files
 * 2. Embed the query and rank fragments (optional)
 * 3. Summarize the project and prepare bounded file previews
 * 4. Render everything into a prompt
 *
 * Embedding and ranking failures never reach the caller: the context simply
 * has no matches. File store failures propagate.
 */
@Service
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    static final String TRUNCATION_MARKER = "\n[Content truncated]";

    private static final String PREAMBLE =
            "You are an AI assistant helping with code analysis and development. Here's the context of the project:";
    private static final String CLOSING =
            "Please provide a helpful response based on the code context above. "
                    + "Reference specific files, functions, or code sections when relevant.";

    private final SourceFileStore fileStore;
    private final SimilarityRanker ranker;
    private final ContextProperties properties;

    public ContextAssembler(SourceFileStore fileStore, SimilarityRanker ranker, ContextProperties properties) {
        this.fileStore = fileStore;
        this.ranker = ranker;
        this.properties = properties;
    }

    /**
     * Gathers context for a query.
     *
     * @param query     The user query
     * @param sessionId The chat session whose files are used
     * @param provider  Embedding provider for vector search, or null to skip it
     * @return The assembled context, empty when the session has no files
     */
    public AssembledContext buildContext(String query, String sessionId, EmbeddingProvider provider) {
        List<SourceFile> files = resolveFiles(sessionId);
        log.info("Found {} files for session {}", files.size(), sessionId);

        if (files.isEmpty()) {
            log.warn("No files found for session {}, building context without project files", sessionId);
            return AssembledContext.empty(query);
        }

        List<RankedMatch> matches;
        if (provider != null) {
            matches = findMatches(query, files, provider);
        } else {
            log.warn("No embedding provider available, skipping vector search for session {}", sessionId);
            matches = List.of();
        }

        return new AssembledContext(query, summarize(files), matches, previews(files));
    }

    /**
     * Renders the context into a prompt. A context without files yields the query unchanged.
     */
    public String buildPrompt(String query, AssembledContext context) {
        if (!context.hasFiles()) {
            return query;
        }

        ProjectSummary summary = context.summary();
        StringBuilder prompt = new StringBuilder();
        prompt.append(PREAMBLE).append("\n\n");

        prompt.append("## Project Overview\n");
        prompt.append("- Total files: ").append(summary.totalFiles()).append('\n');
        prompt.append("- Languages: ").append(String.join(", ", summary.languages())).append('\n');
        prompt.append("- Total lines of code: ").append(summary.totalLines()).append('\n');
        if (!summary.mainFiles().isEmpty()) {
            prompt.append("- Main files: ").append(String.join(", ", summary.mainFiles())).append('\n');
        }
        prompt.append('\n');

        if (!context.matches().isEmpty()) {
            prompt.append("## Most Relevant Code Sections\n");
            List<RankedMatch> shown = limit(context.matches(), properties.getPromptMatchLimit());
            for (int i = 0; i < shown.size(); i++) {
                RankedMatch match = shown.get(i);
                Fragment fragment = match.fragment();
                prompt.append("### ").append(i + 1).append(". ").append(match.file().name())
                        .append(" (").append(fragment.kind().tag()).append(", lines ").append(fragment.lines())
                        .append(')');
                // A similarity that rounds to zero carries no signal and is left out
                if (match.similarity() != 0.0) {
                    prompt.append(" - Similarity: ").append(match.similarity());
                }
                prompt.append('\n');
                appendCodeBlock(prompt, match.file().language(), truncate(fragment.content()));
            }
        } else if (!context.previews().isEmpty()) {
            prompt.append("## Project Files\n");
            List<FilePreview> shown = limit(context.previews(), properties.getPreviewFileLimit());
            for (int i = 0; i < shown.size(); i++) {
                FilePreview preview = shown.get(i);
                prompt.append("### ").append(i + 1).append(". ").append(preview.name())
                        .append(" (").append(preview.language()).append(")\n");
                appendCodeBlock(prompt, preview.language(), preview.content());
            }
        }

        prompt.append("## User Question\n");
        prompt.append(query).append("\n\n");
        prompt.append(CLOSING);

        return prompt.toString();
    }

    private List<SourceFile> resolveFiles(String sessionId) {
        List<SourceFile> files = fileStore.listFilesForSession(sessionId);
        if (!files.isEmpty() || !properties.isClaimUnassignedFiles()) {
            return files;
        }

        List<SourceFile> unassigned = fileStore.listFilesWithoutSession();
        if (unassigned.isEmpty()) {
            return files;
        }

        fileStore.reassignFilesToSession(unassigned.stream().map(SourceFile::id).toList(), sessionId);
        log.info("Assigned {} unassigned files to session {}", unassigned.size(), sessionId);
        return fileStore.listFilesForSession(sessionId);
    }

    private List<RankedMatch> findMatches(String query, List<SourceFile> files, EmbeddingProvider provider) {
        try {
            EmbeddingVector queryVector = provider.embed(query);
            List<RankedMatch> matches = ranker.findSimilar(queryVector, files, properties.getSimilarityLimit());
            log.info("Found {} relevant fragments for query", matches.size());
            if (!matches.isEmpty()) {
                log.debug("Top similarity scores: {}", limit(matches, 3).stream().map(RankedMatch::similarity).toList());
            }
            return matches.stream().map(RankedMatch::rounded).toList();
        } catch (RuntimeException e) {
            log.error("Error generating embeddings for query, continuing without code matches: {}", e.getMessage(), e);
            return List.of();
        }
    }

    ProjectSummary summarize(List<SourceFile> files) {
        Set<String> languages = new LinkedHashSet<>();
        int totalLines = 0;
        for (SourceFile file : files) {
            languages.add(file.language());
            totalLines += file.lineCount();
        }

        List<String> mainFiles = files.stream()
                .map(SourceFile::name)
                .filter(this::isMainFile)
                .toList();

        return new ProjectSummary(files.size(), List.copyOf(languages), totalLines, mainFiles);
    }

    private boolean isMainFile(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return properties.getMainFileMarkers().stream()
                .anyMatch(marker -> lower.contains(marker.toLowerCase(Locale.ROOT)));
    }

    private List<FilePreview> previews(List<SourceFile> files) {
        return limit(files, properties.getContextFileLimit()).stream()
                .map(file -> {
                    String content = file.content() == null ? "" : file.content();
                    boolean truncated = content.length() > properties.getPreviewCharBudget();
                    return new FilePreview(
                            file.name(), file.language(), truncate(content), file.fragments().size(), truncated);
                })
                .toList();
    }

    /**
     * Cuts content to the character budget and marks the cut. A surrogate pair
     * is never split, so the cut may fall one character short of the budget.
     */
    String truncate(String content) {
        int budget = properties.getPreviewCharBudget();
        if (content.length() <= budget) {
            return content;
        }
        int end = budget;
        if (end > 0 && Character.isHighSurrogate(content.charAt(end - 1))) {
            end--;
        }
        return content.substring(0, end) + TRUNCATION_MARKER;
    }

    private static void appendCodeBlock(StringBuilder prompt, String language, String content) {
        prompt.append("```").append(language == null ? "text" : language).append('\n');
        prompt.append(content).append('\n');
        prompt.append("```\n\n");
    }

    private static <T> List<T> limit(List<T> items, int max) {
        return items.subList(0, Math.max(0, Math.min(max, items.size())));
    }
}
