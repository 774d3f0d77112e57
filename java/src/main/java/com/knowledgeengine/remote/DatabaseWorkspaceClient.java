package com.knowledgeengine.remote;

import com.knowledgeengine.config.KnowledgeProperties;
import com.knowledgeengine.model.graph.TraversalResult;
import com.knowledgeengine.model.graph.Subgraph;
import com.knowledgeengine.model.graph.WorkspaceEntry;
import com.knowledgeengine.model.graph.WorkspaceStrategy;
import com.knowledgeengine.service.CostBoundedSearch;
import com.knowledgeengine.service.WorkspaceCrossing;
import com.knowledgeengine.util.GraphMapper;
import io.r2dbc.spi.ConnectionFactories;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads a workspace stored in another database on this machine and runs the export search there.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseWorkspaceClient implements WorkspaceClient {

    private final GraphMapper graphMapper;
    private final KnowledgeProperties properties;

    private final Map<String, DatabaseGraphReader> readers = new ConcurrentHashMap<>();

    @Override
    public WorkspaceStrategy strategy() {
        return WorkspaceStrategy.LOCAL_DATABASE;
    }

    @Override
    public Mono<Subgraph> fetchSubgraph(WorkspaceEntry workspace, String uri) {
        return Mono.defer(() -> {
            DatabaseGraphReader reader = readers.computeIfAbsent(workspace.getId(), id -> {
                log.info("Opening database of workspace '{}'", id);
                return new DatabaseGraphReader(
                        DatabaseClient.create(ConnectionFactories.get(workspace.getR2dbcUrl())), graphMapper);
            });
            return new CostBoundedSearch(reader)
                    .search(uri, properties.getRemote().getExportMaxCost(), properties.getContext().getCap(),
                            WorkspaceCrossing.NONE)
                    .map(TraversalResult::toSubgraph);
        });
    }
}
