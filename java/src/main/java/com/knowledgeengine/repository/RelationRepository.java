package com.knowledgeengine.repository;

import com.knowledgeengine.model.entity.RelationEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

/**
 * Repository for relation rows.
 *
 * Reads return relations ordered by creation time, then insertion id.
 */
@Repository
public interface RelationRepository extends ReactiveCrudRepository<RelationEntity, Long> {

    @Query("SELECT * FROM relations WHERE source_uri = :uri ORDER BY created_at ASC, id ASC")
    Flux<RelationEntity> findOutgoing(String uri);

    @Query("SELECT * FROM relations WHERE target_uri = :uri ORDER BY created_at ASC, id ASC")
    Flux<RelationEntity> findIncoming(String uri);

    @Query("SELECT * FROM relations WHERE source_uri = :uri OR target_uri = :uri ORDER BY created_at ASC, id ASC")
    Flux<RelationEntity> findIncident(String uri);

    Mono<RelationEntity> findBySourceUriAndTargetUriAndRelationType(String sourceUri, String targetUri, String relationType);

    /**
     * Relations whose both endpoints are in the given set. Callers must not pass an empty collection.
     */
    @Query("SELECT * FROM relations WHERE source_uri IN (:uris) AND target_uri IN (:uris) ORDER BY created_at ASC, id ASC")
    Flux<RelationEntity> findAmong(Collection<String> uris);

    @Modifying
    @Query("DELETE FROM relations WHERE source_uri = :uri OR target_uri = :uri")
    Mono<Integer> deleteIncident(String uri);

    @Modifying
    @Query("UPDATE relations SET source_uri = :newUri WHERE source_uri = :oldUri")
    Mono<Integer> rewriteSource(String oldUri, String newUri);

    @Modifying
    @Query("UPDATE relations SET target_uri = :newUri WHERE target_uri = :oldUri")
    Mono<Integer> rewriteTarget(String oldUri, String newUri);

    @Query("SELECT COUNT(*) FROM relations")
    Mono<Long> countAll();
}
