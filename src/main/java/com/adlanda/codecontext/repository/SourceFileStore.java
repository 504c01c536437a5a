package com.adlanda.codecontext.repository;

import com.adlanda.codecontext.model.Fragment;
import com.adlanda.codecontext.model.SourceFile;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Access to uploaded source files.
 *
 * Failures of the underlying store propagate as unchecked exceptions; callers
 * cannot build context without being able to read files.
 */
public interface SourceFileStore {

    List<SourceFile> listFilesForSession(String sessionId);

    List<SourceFile> listFilesWithoutSession();

    void reassignFilesToSession(Collection<String> fileIds, String sessionId);

    /**
     * Overwrites the whole file record, fragment list included.
     */
    void saveFile(SourceFile file);

    /**
     * Replaces only the fragment list of a file. Session and content are left
     * as currently stored, so a concurrent reassignment is never undone.
     *
     * @return false if the file does not exist
     */
    boolean updateFragments(String fileId, List<Fragment> fragments);

    Optional<SourceFile> findById(String fileId);

    long count();
}
