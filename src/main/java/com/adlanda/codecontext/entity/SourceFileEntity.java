package com.adlanda.codecontext.entity;

import com.adlanda.codecontext.model.Fragment;
import com.adlanda.codecontext.model.SourceFile;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for an uploaded source file and its fragments.
 *
 * A save overwrites the whole record; embedding runs replace only the fragment list.
 */
@Entity
@Table(name = "source_files", indexes = @Index(name = "idx_source_files_session", columnList = "session_id"))
public class SourceFileEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "session_id", length = 100)
    private String sessionId;

    @Column(name = "name", nullable = false, length = 500)
    private String name;

    @Column(name = "language", nullable = false, length = 32)
    private String language;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "uploaded_at", nullable = false)
    private Instant uploadedAt;

    @ElementCollection
    @CollectionTable(name = "source_file_fragments", joinColumns = @JoinColumn(name = "file_id"))
    @OrderColumn(name = "list_index")
    private List<FragmentEmbeddable> fragments = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "source_file_dependencies", joinColumns = @JoinColumn(name = "file_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "dependency", length = 500)
    private List<String> dependencies = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "source_file_exports", joinColumns = @JoinColumn(name = "file_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "export_name", length = 500)
    private List<String> exports = new ArrayList<>();

    // Default constructor for JPA
    protected SourceFileEntity() {
    }

    public static SourceFileEntity from(SourceFile file) {
        SourceFileEntity entity = new SourceFileEntity();
        entity.id = file.id();
        entity.sessionId = file.sessionId();
        entity.name = file.name();
        entity.language = file.language();
        entity.content = file.content();
        entity.uploadedAt = file.uploadedAt();
        file.fragments().forEach(f -> entity.fragments.add(FragmentEmbeddable.from(f)));
        entity.dependencies.addAll(file.dependencies());
        entity.exports.addAll(file.exports());
        return entity;
    }

    public void replaceFragments(List<Fragment> updated) {
        fragments.clear();
        updated.forEach(f -> fragments.add(FragmentEmbeddable.from(f)));
    }

    /**
     * Converts to the domain record. Must run inside a transaction so the
     * lazily loaded collections can be read.
     */
    public SourceFile toSourceFile() {
        return new SourceFile(
                id,
                sessionId,
                name,
                language,
                content,
                fragments.stream().map(FragmentEmbeddable::toFragment).toList(),
                List.copyOf(dependencies),
                List.copyOf(exports),
                uploadedAt
        );
    }

    @Override
    public String toString() {
        return "SourceFileEntity{" +
                "id='" + id + '\'' +
                ", sessionId='" + sessionId + '\'' +
                ", name='" + name + '\'' +
                ", fragments=" + fragments.size() +
                '}';
    }
}
