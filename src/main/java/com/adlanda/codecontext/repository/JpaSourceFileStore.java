package com.adlanda.codecontext.repository;

import com.adlanda.codecontext.entity.SourceFileEntity;
import com.adlanda.codecontext.model.Fragment;
import com.adlanda.codecontext.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@link SourceFileStore} backed by JPA.
 *
 * Entities are converted to records inside the transaction, so callers never
 * see lazily loaded collections.
 */
@Repository
@Transactional(readOnly = true)
public class JpaSourceFileStore implements SourceFileStore {

    private static final Logger log = LoggerFactory.getLogger(JpaSourceFileStore.class);

    private final SourceFileRepository repository;

    public JpaSourceFileStore(SourceFileRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<SourceFile> listFilesForSession(String sessionId) {
        return repository.findBySessionIdOrderByUploadedAtDesc(sessionId).stream()
                .map(SourceFileEntity::toSourceFile)
                .toList();
    }

    @Override
    public List<SourceFile> listFilesWithoutSession() {
        return repository.findUnassigned().stream()
                .map(SourceFileEntity::toSourceFile)
                .toList();
    }

    @Override
    @Transactional
    public void reassignFilesToSession(Collection<String> fileIds, String sessionId) {
        if (fileIds.isEmpty()) {
            return;
        }
        int updated = repository.assignSession(fileIds, sessionId);
        log.debug("Assigned {} files to session {}", updated, sessionId);
    }

    @Override
    @Transactional
    public void saveFile(SourceFile file) {
        repository.save(SourceFileEntity.from(file));
        log.debug("Saved file {} with {} fragments", file.name(), file.fragments().size());
    }

    @Override
    @Transactional
    public boolean updateFragments(String fileId, List<Fragment> fragments) {
        return repository.findById(fileId)
                .map(entity -> {
                    // Dirty checking writes the fragment rows only; session_id is not part of the update
                    entity.replaceFragments(fragments);
                    log.debug("Updated {} fragments of file {}", fragments.size(), fileId);
                    return true;
                })
                .orElse(false);
    }

    @Override
    public Optional<SourceFile> findById(String fileId) {
        return repository.findById(fileId).map(SourceFileEntity::toSourceFile);
    }

    @Override
    public long count() {
        return repository.count();
    }
}
