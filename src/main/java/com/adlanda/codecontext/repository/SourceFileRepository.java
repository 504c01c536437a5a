package com.adlanda.codecontext.repository;

import com.adlanda.codecontext.entity.SourceFileEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Spring Data repository for uploaded source files.
 */
@Repository
public interface SourceFileRepository extends JpaRepository<SourceFileEntity, String> {

    /**
     * Files of a session, most recent upload first.
     */
    List<SourceFileEntity> findBySessionIdOrderByUploadedAtDesc(String sessionId);

    /**
     * Files uploaded without a session (null or empty session id), most recent first.
     */
    @Query("SELECT f FROM SourceFileEntity f WHERE f.sessionId IS NULL OR f.sessionId = '' ORDER BY f.uploadedAt DESC")
    List<SourceFileEntity> findUnassigned();

    /**
     * Moves the given files to a session.
     *
     * @return Number of rows updated
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SourceFileEntity f SET f.sessionId = :sessionId WHERE f.id IN :ids")
    int assignSession(@Param("ids") Collection<String> ids, @Param("sessionId") String sessionId);
}
