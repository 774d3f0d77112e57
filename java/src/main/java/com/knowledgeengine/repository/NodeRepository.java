package com.knowledgeengine.repository;

import com.knowledgeengine.model.entity.NodeEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

/**
 * Repository for node rows, addressed by URI.
 */
@Repository
public interface NodeRepository extends ReactiveCrudRepository<NodeEntity, Long> {

    Mono<NodeEntity> findByUri(String uri);

    /**
     * Callers must not pass an empty collection.
     */
    Flux<NodeEntity> findByUriIn(Collection<String> uris);

    Mono<Boolean> existsByUri(String uri);

    @Modifying
    @Query("UPDATE nodes SET uri = :newUri, updated_at = :updatedAt WHERE uri = :oldUri")
    Mono<Integer> renameUri(String oldUri, String newUri, LocalDateTime updatedAt);

    @Modifying
    @Query("DELETE FROM nodes WHERE uri = :uri")
    Mono<Integer> deleteByUri(String uri);
}
