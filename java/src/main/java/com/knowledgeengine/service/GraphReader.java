package com.knowledgeengine.service;

import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.Relation;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read access needed by the cost-bounded search.
 */
public interface GraphReader {

    /**
     * @return the node, or empty when no node has this URI
     */
    Mono<Node> getNode(String uri);

    /**
     * Outgoing relations ordered by creation time, then insertion order.
     */
    Flux<Relation> getOutgoing(String uri);
}
