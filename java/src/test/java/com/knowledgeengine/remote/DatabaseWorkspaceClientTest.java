package com.knowledgeengine.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeengine.config.KnowledgeProperties;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.Relation;
import com.knowledgeengine.model.graph.WorkspaceEntry;
import com.knowledgeengine.model.graph.WorkspaceStrategy;
import com.knowledgeengine.util.GraphMapper;
import io.r2dbc.spi.ConnectionFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Reads a second H2 database laid out like the local store.
 */
class DatabaseWorkspaceClientTest {

    private static final String URL = "r2dbc:h2:mem:///team-workspace?options=DB_CLOSE_DELAY=-1";

    private DatabaseWorkspaceClient client;
    private WorkspaceEntry workspace;

    @BeforeEach
    void setUp() {
        DatabaseClient databaseClient = DatabaseClient.create(ConnectionFactories.get(URL));
        List<String> statements = List.of(
                "DROP TABLE IF EXISTS relations",
                "DROP TABLE IF EXISTS nodes",
                "CREATE TABLE nodes (id BIGINT AUTO_INCREMENT PRIMARY KEY, uri VARCHAR(2048) NOT NULL UNIQUE, " +
                        "node_type VARCHAR(16) NOT NULL, name VARCHAR(1024), content VARCHAR(65536), " +
                        "metadata VARCHAR(65536), created_at TIMESTAMP NOT NULL, updated_at TIMESTAMP NOT NULL)",
                "CREATE TABLE relations (id BIGINT AUTO_INCREMENT PRIMARY KEY, source_uri VARCHAR(2048) NOT NULL, " +
                        "target_uri VARCHAR(2048) NOT NULL, relation_type VARCHAR(255) NOT NULL, " +
                        "weight DOUBLE PRECISION NOT NULL, metadata VARCHAR(65536), created_at TIMESTAMP NOT NULL)",
                "INSERT INTO nodes (uri, node_type, name, content, metadata, created_at, updated_at) VALUES " +
                        "('concept://team/a', 'concept', 'A', 'About a', '{\"owner\":\"team\"}', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP), " +
                        "('concept://team/b', 'concept', 'B', NULL, NULL, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP), " +
                        "('concept://team/c', 'concept', 'C', NULL, NULL, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
                "INSERT INTO relations (source_uri, target_uri, relation_type, weight, metadata, created_at) VALUES " +
                        "('concept://team/a', 'concept://team/b', 'related', 0.5, NULL, CURRENT_TIMESTAMP), " +
                        "('concept://team/b', 'concept://team/c', 'related', 0.7, NULL, CURRENT_TIMESTAMP)");
        Flux.fromIterable(statements)
                .concatMap(sql -> databaseClient.sql(sql).then())
                .blockLast();

        client = new DatabaseWorkspaceClient(new GraphMapper(new ObjectMapper()), new KnowledgeProperties());
        workspace = WorkspaceEntry.builder()
                .id("team")
                .strategy(WorkspaceStrategy.LOCAL_DATABASE)
                .r2dbcUrl(URL)
                .build();
    }

    @Test
    void fetchSubgraph_ExportsNodesWithinBudget() {
        StepVerifier.create(client.fetchSubgraph(workspace, "concept://team/a"))
                .assertNext(subgraph -> {
                    assertThat(subgraph.getNodes()).extracting(Node::getUri)
                            .containsExactly("concept://team/a", "concept://team/b");
                    assertThat(subgraph.getNodes().get(0).getMetadata().get("owner").asText()).isEqualTo("team");
                    assertThat(subgraph.getRelations()).extracting(Relation::getTargetUri)
                            .containsExactly("concept://team/b");
                })
                .verifyComplete();
    }

    @Test
    void fetchSubgraph_UnknownSeed_EmptySubgraph() {
        StepVerifier.create(client.fetchSubgraph(workspace, "concept://team/missing"))
                .assertNext(subgraph -> assertThat(subgraph.getNodes()).isEmpty())
                .verifyComplete();
    }
}
