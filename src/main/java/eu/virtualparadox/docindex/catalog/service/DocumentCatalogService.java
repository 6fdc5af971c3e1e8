package eu.virtualparadox.docindex.catalog.service;

import eu.virtualparadox.docindex.catalog.entity.DocumentEntity;
import eu.virtualparadox.docindex.catalog.repo.DocumentRepository;
import eu.virtualparadox.docindex.rag.index.DocumentMeta;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service layer over the document-metadata table.
 * <p>
 * Responsibilities:
 * <ul>
 *     <li>Recording a document once all of its chunks are in the Lucene index</li>
 *     <li>Lookups by hash, by logical name within an orphan scope, and by age</li>
 *     <li>Keeping the full document text used by regex search</li>
 * </ul>
 *
 * <p>Chunk rows live in Lucene; the {@code fileHash} is the link between both stores.</p>
 */
@Service
@RequiredArgsConstructor
public class DocumentCatalogService {

    private final DocumentRepository repository;

    /**
     * Inserts or replaces the metadata row of a document.
     *
     * @param meta     document metadata
     * @param fullText full extracted text (may be {@code null})
     * @return the stored metadata
     */
    @Transactional
    public DocumentMeta save(final DocumentMeta meta, final String fullText) {
        final DocumentEntity entity = DocumentEntity.builder()
                .fileHash(meta.fileHash())
                .fileName(meta.fileName())
                .mediaType(meta.mediaType())
                .sizeBytes(meta.sizeBytes())
                .totalChunks(meta.totalChunks())
                .indexedAt(meta.indexedAt())
                .orphanScope(meta.orphanScope())
                .generation(meta.generation())
                .fullText(fullText)
                .build();
        return toMeta(repository.save(entity));
    }

    @Transactional(readOnly = true)
    public Optional<DocumentMeta> findByHash(final String fileHash) {
        return repository.findById(fileHash).map(DocumentCatalogService::toMeta);
    }

    @Transactional(readOnly = true)
    public List<DocumentMeta> findByName(final String fileName, final String orphanScope) {
        return repository.findByFileNameAndOrphanScope(fileName, orphanScope).stream()
                .map(DocumentCatalogService::toMeta)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<DocumentMeta> findIndexedBefore(final Instant cutoff) {
        return repository.findByIndexedAtBefore(cutoff).stream()
                .map(DocumentCatalogService::toMeta)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<DocumentMeta> listAll() {
        return repository.findAll().stream()
                .map(DocumentCatalogService::toMeta)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<String> findFullText(final String fileHash) {
        return repository.findFullText(fileHash);
    }

    @Transactional(readOnly = true)
    public long count() {
        return repository.count();
    }

    @Transactional(readOnly = true)
    public long sumSizeBytes() {
        return repository.sumSizeBytes();
    }

    /**
     * Deletes the metadata row of a document if present.
     *
     * @param fileHash document hash
     * @return {@code true} if a row was removed
     */
    @Transactional
    public boolean delete(final String fileHash) {
        if (!repository.existsById(fileHash)) {
            return false;
        }
        repository.deleteById(fileHash);
        return true;
    }

    private static DocumentMeta toMeta(final DocumentEntity e) {
        return DocumentMeta.builder()
                .fileHash(e.getFileHash())
                .fileName(e.getFileName())
                .mediaType(e.getMediaType())
                .sizeBytes(e.getSizeBytes())
                .indexedAt(e.getIndexedAt())
                .totalChunks(e.getTotalChunks())
                .orphanScope(e.getOrphanScope())
                .generation(e.getGeneration())
                .build();
    }
}
