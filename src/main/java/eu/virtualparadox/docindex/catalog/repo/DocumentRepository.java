package eu.virtualparadox.docindex.catalog.repo;

import eu.virtualparadox.docindex.catalog.entity.DocumentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DocumentRepository extends JpaRepository<DocumentEntity, String> {

    List<DocumentEntity> findByFileNameAndOrphanScope(String fileName, String orphanScope);

    List<DocumentEntity> findByIndexedAtBefore(Instant cutoff);

    @Query("select coalesce(sum(d.sizeBytes), 0) from DocumentEntity d")
    long sumSizeBytes();

    @Query("select d.fullText from DocumentEntity d where d.fileHash = :hash")
    Optional<String> findFullText(@Param("hash") String fileHash);
}
