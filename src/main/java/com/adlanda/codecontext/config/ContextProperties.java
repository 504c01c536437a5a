package com.adlanda.codecontext.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Configuration properties for context assembly.
 *
 * Maps to properties prefixed with 'codecontext.context' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "codecontext.context")
public class ContextProperties {

    /**
     * Whether a session without files claims files that were uploaded without any session.
     * Compatibility fallback for uploads that happen before the chat session exists;
     * it can attach files left behind by an abandoned upload to the wrong session.
     */
    private boolean claimUnassignedFiles = true;

    /**
     * Number of fragments retrieved by vector search for each query.
     */
    private int similarityLimit = 10;

    /**
     * Number of retrieved fragments rendered into the prompt.
     */
    private int promptMatchLimit = 5;

    /**
     * Number of files kept as raw previews in the assembled context.
     */
    private int contextFileLimit = 5;

    /**
     * Number of raw previews rendered into the prompt when nothing matched.
     */
    private int previewFileLimit = 3;

    /**
     * Maximum characters of file content included per preview.
     */
    private int previewCharBudget = 2000;

    /**
     * Case-insensitive name fragments that mark a file as an entry point.
     */
    private List<String> mainFileMarkers = List.of("index", "main", "app");

    public boolean isClaimUnassignedFiles() {
        return claimUnassignedFiles;
    }

    public void setClaimUnassignedFiles(boolean claimUnassignedFiles) {
        this.claimUnassignedFiles = claimUnassignedFiles;
    }

    public int getSimilarityLimit() {
        return similarityLimit;
    }

    public void setSimilarityLimit(int similarityLimit) {
        this.similarityLimit = similarityLimit;
    }

    public int getPromptMatchLimit() {
        return promptMatchLimit;
    }

    public void setPromptMatchLimit(int promptMatchLimit) {
        this.promptMatchLimit = promptMatchLimit;
    }

    public int getContextFileLimit() {
        return contextFileLimit;
    }

    public void setContextFileLimit(int contextFileLimit) {
        this.contextFileLimit = contextFileLimit;
    }

    public int getPreviewFileLimit() {
        return previewFileLimit;
    }

    public void setPreviewFileLimit(int previewFileLimit) {
        this.previewFileLimit = previewFileLimit;
    }

    public int getPreviewCharBudget() {
        return previewCharBudget;
    }

    public void setPreviewCharBudget(int previewCharBudget) {
        this.previewCharBudget = previewCharBudget;
    }

    public List<String> getMainFileMarkers() {
        return mainFileMarkers;
    }

    public void setMainFileMarkers(List<String> mainFileMarkers) {
        this.mainFileMarkers = mainFileMarkers;
    }
}
