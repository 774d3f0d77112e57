package com.knowledgeengine.remote;

import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.NodeType;
import com.knowledgeengine.model.graph.Relation;
import com.knowledgeengine.service.GraphReader;
import com.knowledgeengine.util.GraphMapper;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Reads another workspace's database directly, with the same table layout as the local store.
 */
public class DatabaseGraphReader implements GraphReader {

    private final DatabaseClient databaseClient;
    private final GraphMapper graphMapper;

    public DatabaseGraphReader(DatabaseClient databaseClient, GraphMapper graphMapper) {
        this.databaseClient = databaseClient;
        this.graphMapper = graphMapper;
    }

    @Override
    public Mono<Node> getNode(String uri) {
        return databaseClient.sql("SELECT uri, node_type, name, content, metadata, created_at, updated_at " +
                        "FROM nodes WHERE uri = :uri")
                .bind("uri", uri)
                .map((row, metadata) -> Node.builder()
                        .uri(row.get("uri", String.class))
                        .nodeType(NodeType.fromScheme(row.get("node_type", String.class)))
                        .name(row.get("name", String.class))
                        .content(row.get("content", String.class))
                        .metadata(graphMapper.readMetadata(row.get("metadata", String.class), uri))
                        .createdAt(row.get("created_at", LocalDateTime.class))
                        .updatedAt(row.get("updated_at", LocalDateTime.class))
                        .build())
                .one();
    }

    @Override
    public Flux<Relation> getOutgoing(String uri) {
        return databaseClient.sql("SELECT source_uri, target_uri, relation_type, weight, metadata, created_at " +
                        "FROM relations WHERE source_uri = :uri ORDER BY created_at ASC, id ASC")
                .bind("uri", uri)
                .map((row, metadata) -> {
                    Double weight = row.get("weight", Double.class);
                    return Relation.builder()
                            .sourceUri(row.get("source_uri", String.class))
                            .targetUri(row.get("target_uri", String.class))
                            .relationType(row.get("relation_type", String.class))
                            .weight(weight == null ? 1.0 : weight)
                            .metadata(graphMapper.readMetadata(row.get("metadata", String.class), uri))
                            .createdAt(row.get("created_at", LocalDateTime.class))
                            .build();
                })
                .all();
    }
}
