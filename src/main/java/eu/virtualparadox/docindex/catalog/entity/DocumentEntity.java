package eu.virtualparadox.docindex.catalog.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One indexed document, keyed by the SHA-256 of its bytes. The row is written last when a document
 * is indexed, so its presence marks a complete index.
 */
@Entity
@Table(name = "documents", indexes = {
        @Index(name = "idx_documents_name_scope", columnList = "file_name, orphan_scope"),
        @Index(name = "idx_documents_indexed_at", columnList = "indexed_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentEntity {

    @Id
    @Column(name = "file_hash", length = 64, nullable = false)
    private String fileHash;

    @Column(name = "file_name", length = 512, nullable = false)
    private String fileName;

    @Column(name = "media_type", length = 128, nullable = false)
    private String mediaType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "total_chunks", nullable = false)
    private int totalChunks;

    @Column(name = "indexed_at", nullable = false)
    private Instant indexedAt;

    @Column(name = "orphan_scope", length = 128, nullable = false)
    private String orphanScope;

    @Column(name = "generation", length = 36)
    private String generation;

    @Lob
    @Column(name = "full_text")
    @ToString.Exclude
    private String fullText;
}
