package eu.virtualparadox.companion.catalog.repo;

import eu.virtualparadox.companion.catalog.EDocumentStatus;
import eu.virtualparadox.companion.catalog.entity.DocumentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

/**
 * Status updates are guarded by the expected current status, so a document deleted or
 * finished by another thread is never resurrected. Each method returns the number of rows changed.
 */
public interface DocumentRepository extends JpaRepository<DocumentEntity, String> {

    List<DocumentEntity> findAllByOrderByCreatedAtDesc();

    @Query("select d.id from DocumentEntity d where d.status = :status")
    List<String> findIdsByStatus(@Param("status") EDocumentStatus status);

    @Modifying(clearAutomatically = true)
    @Query("update DocumentEntity d set d.status = :to, d.error = null where d.id = :id and d.status = :from")
    int transition(@Param("id") String id,
                   @Param("from") EDocumentStatus from,
                   @Param("to") EDocumentStatus to);

    @Modifying(clearAutomatically = true)
    @Query("update DocumentEntity d set d.status = eu.virtualparadox.companion.catalog.EDocumentStatus.READY, " +
            "d.chunkCount = :chunks, d.embedModel = :embedModel, d.ingestedAt = :ingestedAt, d.error = null " +
            "where d.id = :id and d.status = eu.virtualparadox.companion.catalog.EDocumentStatus.PROCESSING")
    int markReady(@Param("id") String id,
                  @Param("chunks") int chunks,
                  @Param("embedModel") String embedModel,
                  @Param("ingestedAt") Instant ingestedAt);

    @Modifying(clearAutomatically = true)
    @Query("update DocumentEntity d set d.status = eu.virtualparadox.companion.catalog.EDocumentStatus.FAILED, " +
            "d.chunkCount = 0, d.error = :error " +
            "where d.id = :id and d.status = eu.virtualparadox.companion.catalog.EDocumentStatus.PROCESSING")
    int markFailed(@Param("id") String id, @Param("error") String error);
}
