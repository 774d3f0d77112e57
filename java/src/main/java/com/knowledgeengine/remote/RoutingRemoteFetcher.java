package com.knowledgeengine.remote;

import com.knowledgeengine.config.KnowledgeProperties;
import com.knowledgeengine.exception.RemoteUnavailableException;
import com.knowledgeengine.model.graph.NodeUri;
import com.knowledgeengine.model.graph.Subgraph;
import com.knowledgeengine.model.graph.WorkspaceEntry;
import com.knowledgeengine.model.graph.WorkspaceStrategy;
import com.knowledgeengine.service.WorkspaceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Picks the client for a URI's workspace and bounds the fetch by the configured timeout.
 * Every failure surfaces as {@link RemoteUnavailableException}.
 */
@Slf4j
@Component
public class RoutingRemoteFetcher implements RemoteFetcher {

    private final WorkspaceRegistry workspaceRegistry;
    private final Map<WorkspaceStrategy, WorkspaceClient> clients = new EnumMap<>(WorkspaceStrategy.class);
    private final Duration timeout;

    public RoutingRemoteFetcher(List<WorkspaceClient> clients, WorkspaceRegistry workspaceRegistry,
                                KnowledgeProperties properties) {
        this.workspaceRegistry = workspaceRegistry;
        this.timeout = properties.getRemote().getTimeout();
        clients.forEach(client -> this.clients.put(client.strategy(), client));
    }

    @Override
    public Mono<Subgraph> fetchSubgraph(String uri) {
        return Mono.defer(() -> {
            NodeUri parsed = NodeUri.parse(uri);
            WorkspaceEntry workspace = workspaceRegistry.find(parsed.getWorkspaceId())
                    .filter(entry -> workspaceRegistry.isRemote(entry.getId()))
                    .orElse(null);
            if (workspace == null) {
                return Mono.error(new RemoteUnavailableException(uri,
                        "Workspace '" + parsed.getWorkspaceId() + "' is not a registered remote workspace"));
            }
            WorkspaceClient client = clients.get(workspace.getStrategy());
            if (client == null) {
                return Mono.error(new RemoteUnavailableException(uri,
                        "No client for workspace strategy " + workspace.getStrategy()));
            }
            log.debug("Fetching {} from workspace '{}' ({})", uri, workspace.getId(), workspace.getStrategy());
            return client.fetchSubgraph(workspace, uri)
                    .defaultIfEmpty(Subgraph.builder().seedUri(uri).build())
                    .timeout(timeout);
        })
        .onErrorMap(error -> !(error instanceof RemoteUnavailableException),
                error -> new RemoteUnavailableException(uri, describe(error), error))
        .doOnError(error -> log.warn("Remote fetch of {} failed: {}", uri, error.getMessage()));
    }

    private String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "No answer within " + timeout.toMillis() + " ms";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
