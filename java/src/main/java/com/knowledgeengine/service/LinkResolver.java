package com.knowledgeengine.service;

import com.knowledgeengine.model.entity.NodeEntity;
import com.knowledgeengine.model.graph.GraphWarning;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.NodeType;
import com.knowledgeengine.model.graph.NodeUri;
import com.knowledgeengine.repository.NodeRepository;
import com.knowledgeengine.util.GraphMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Decides what happens to a relation endpoint that does not exist locally.
 *
 * <ul>
 *   <li>endpoint in another, remotely reachable workspace: left unresolved with a dangling-reference warning.
 *       Fetching happens before the write, see {@link #needsRemoteFetch}.</li>
 *   <li>{@code resource://} endpoint: a minimal resource node is created.</li>
 *   <li>{@code concept://} endpoint: nothing is created, a dangling-concept warning is returned.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LinkResolver {

    private final NodeRepository nodeRepository;
    private final WorkspaceRegistry workspaceRegistry;
    private final GraphMapper graphMapper;

    /**
     * Resolve one endpoint. Must run inside the caller's write transaction.
     *
     * @param anchorUri the other end of the relation, used to tell whether the endpoint crosses workspaces
     * @param endpointUri endpoint to resolve
     */
    public Mono<Resolution> resolve(String anchorUri, String endpointUri) {
        return nodeRepository.existsByUri(endpointUri)
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.just(Resolution.present(endpointUri));
                    }
                    NodeUri endpoint = NodeUri.parse(endpointUri);
                    if (crossesIntoRemote(anchorUri, endpoint)) {
                        log.debug("Remote endpoint {} not materialized", endpointUri);
                        return Mono.just(Resolution.warned(endpointUri, GraphWarning.danglingReference(endpointUri)));
                    }
                    if (endpoint.getNodeType() == NodeType.RESOURCE) {
                        return createResource(endpointUri).map(node -> Resolution.created(endpointUri, node));
                    }
                    return Mono.just(Resolution.warned(endpointUri, GraphWarning.danglingConcept(endpointUri)));
                });
    }

    /**
     * Whether the endpoint lives in a remote workspace and is not yet materialized here.
     */
    public Mono<Boolean> needsRemoteFetch(String anchorUri, String endpointUri) {
        return Mono.defer(() -> {
            NodeUri endpoint = NodeUri.parse(endpointUri);
            if (!crossesIntoRemote(anchorUri, endpoint)) {
                return Mono.just(false);
            }
            return nodeRepository.existsByUri(endpointUri).map(exists -> !exists);
        });
    }

    private boolean crossesIntoRemote(String anchorUri, NodeUri endpoint) {
        if (!workspaceRegistry.isRemote(endpoint.getWorkspaceId())) {
            return false;
        }
        return NodeUri.tryParse(anchorUri)
                .map(anchor -> !anchor.sameWorkspace(endpoint))
                .orElse(true);
    }

    private Mono<Node> createResource(String uri) {
        LocalDateTime now = LocalDateTime.now();
        NodeEntity entity = NodeEntity.builder()
                .uri(uri)
                .nodeType(NodeType.RESOURCE.getScheme())
                .metadata(graphMapper.writeMetadata(null))
                .createdAt(now)
                .updatedAt(now)
                .build();
        log.info("Auto-creating resource {} for a new relation", uri);
        return nodeRepository.save(entity).map(graphMapper::toNode);
    }

    /**
     * Outcome for one endpoint.
     */
    @Data
    @AllArgsConstructor
    public static class Resolution {
        private String uri;
        private Node created;
        private GraphWarning warning;

        static Resolution present(String uri) {
            return new Resolution(uri, null, null);
        }

        static Resolution created(String uri, Node node) {
            return new Resolution(uri, node, null);
        }

        static Resolution warned(String uri, GraphWarning warning) {
            return new Resolution(uri, null, warning);
        }
    }
}
