package com.knowledgeengine.service;

import com.knowledgeengine.exception.InvalidRequestException;
import com.knowledgeengine.model.graph.ImportOutcome;
import com.knowledgeengine.model.graph.NodeUri;
import com.knowledgeengine.remote.RemoteFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Fetches a subgraph from a remote workspace and imports it locally.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RemoteSubgraphService {

    private final RemoteFetcher remoteFetcher;
    private final WorkspaceRegistry workspaceRegistry;
    private final ConflictResolver conflictResolver;

    /**
     * Fetch the subgraph around {@code uri} and import it.
     *
     * @throws InvalidRequestException if the URI's workspace is not a registered remote one
     */
    public Mono<ImportOutcome> fetch(String uri) {
        return Mono.defer(() -> {
            NodeUri parsed = NodeUri.parse(uri);
            if (!workspaceRegistry.isRemote(parsed.getWorkspaceId())) {
                return Mono.error(new InvalidRequestException(
                        "Workspace '" + parsed.getWorkspaceId() + "' is not a registered remote workspace"));
            }
            log.info("Fetching remote subgraph around {}", uri);
            return remoteFetcher.fetchSubgraph(uri)
                    .flatMap(conflictResolver::importSubgraph)
                    .map(outcome -> {
                        outcome.setUri(uri);
                        return outcome;
                    });
        });
    }
}
