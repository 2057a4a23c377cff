package com.taskq.worker.sink;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Documents are matched with jsonb containment: a row matches when its body contains every
 * field of the query object.
 */
@Repository
public interface StoredDocumentRepository extends JpaRepository<StoredDocument, UUID> {

    @Query(value = "SELECT * FROM documents d WHERE d.collection = :collection "
            + "AND d.body @> CAST(:query AS jsonb) ORDER BY d.created_at", nativeQuery = true)
    List<StoredDocument> findMatching(String collection, String query);

    @Modifying
    @Query(value = "UPDATE documents SET body = body || CAST(:changes AS jsonb), updated_at = :now "
            + "WHERE collection = :collection AND body @> CAST(:query AS jsonb)", nativeQuery = true)
    int mergeMatching(String collection, String query, String changes, Instant now);

    @Modifying
    @Query(value = "DELETE FROM documents WHERE collection = :collection "
            + "AND body @> CAST(:query AS jsonb)", nativeQuery = true)
    int deleteMatching(String collection, String query);
}
