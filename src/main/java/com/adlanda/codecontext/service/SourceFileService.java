package com.adlanda.codecontext.service;

import com.adlanda.codecontext.chunking.Chunker;
import com.adlanda.codecontext.chunking.LanguageDetector;
import com.adlanda.codecontext.config.UploadProperties;
import com.adlanda.codecontext.model.Fragment;
import com.adlanda.codecontext.model.SourceFile;
import com.adlanda.codecontext.repository.SourceFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Service responsible for turning uploaded text into chunked source files.
 */
@Service
public class SourceFileService {

    private static final Logger log = LoggerFactory.getLogger(SourceFileService.class);

    private final SourceFileStore fileStore;
    private final Chunker chunker;
    private final LanguageDetector languageDetector;
    private final UploadProperties uploadProperties;

    public SourceFileService(SourceFileStore fileStore,
                             Chunker chunker,
                             LanguageDetector languageDetector,
                             UploadProperties uploadProperties) {
        this.fileStore = fileStore;
        this.chunker = chunker;
        this.languageDetector = languageDetector;
        this.uploadProperties = uploadProperties;
    }

    /**
     * Chunks and stores an uploaded file. Embeddings are generated separately.
     *
     * @param sessionId Owning session, may be null when uploaded before a session exists
     * @param name      File name as uploaded
     * @param content   Text content
     * @return The stored file
     * @throws UnsupportedSourceFileException if the name matches an excluded path
     * @throws SourceFileTooLargeException if the content exceeds the upload limit
     */
    public SourceFile register(String sessionId, String name, String content) {
        if (languageDetector.isExcluded(name)) {
            throw new UnsupportedSourceFileException(name);
        }
        long limit = uploadProperties.getMaxFileSize().toBytes();
        long size = content.getBytes(StandardCharsets.UTF_8).length;
        if (size > limit) {
            throw new SourceFileTooLargeException(name, size, limit);
        }

        String language = languageDetector.detect(name);
        List<Fragment> fragments = chunker.chunk(content, language);

        SourceFile file = new SourceFile(
                UUID.randomUUID().toString(),
                StringUtils.hasText(sessionId) ? sessionId : null,
                name,
                language,
                content,
                fragments,
                chunker.extractDependencies(content, language),
                chunker.extractExports(content, language),
                Instant.now()
        );

        fileStore.saveFile(file);
        log.info("Registered {} ({}) with {} fragments", name, language, fragments.size());
        return file;
    }

    public List<SourceFile> listFiles(String sessionId) {
        return fileStore.listFilesForSession(sessionId);
    }
}
