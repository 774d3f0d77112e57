package com.knowledgeengine.remote;

import com.knowledgeengine.model.graph.Subgraph;
import reactor.core.publisher.Mono;

/**
 * Fetches the subgraph around a node stored in another workspace.
 */
public interface RemoteFetcher {

    /**
     * @return the subgraph around {@code uri}; empty node list when the remote does not know it
     * @throws com.knowledgeengine.exception.RemoteUnavailableException (as an error signal) when the workspace cannot be reached
     */
    Mono<Subgraph> fetchSubgraph(String uri);
}
