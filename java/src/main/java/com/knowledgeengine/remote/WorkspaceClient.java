package com.knowledgeengine.remote;

import com.knowledgeengine.model.graph.Subgraph;
import com.knowledgeengine.model.graph.WorkspaceEntry;
import com.knowledgeengine.model.graph.WorkspaceStrategy;
import reactor.core.publisher.Mono;

/**
 * Strategy-specific access to one kind of remote workspace.
 */
public interface WorkspaceClient {

    WorkspaceStrategy strategy();

    Mono<Subgraph> fetchSubgraph(WorkspaceEntry workspace, String uri);
}
