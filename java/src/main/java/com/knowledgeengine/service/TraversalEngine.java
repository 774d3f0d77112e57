package com.knowledgeengine.service;

import com.knowledgeengine.config.KnowledgeProperties;
import com.knowledgeengine.exception.InvalidRequestException;
import com.knowledgeengine.exception.NotFoundException;
import com.knowledgeengine.exception.RemoteUnavailableException;
import com.knowledgeengine.model.graph.ConflictReport;
import com.knowledgeengine.model.graph.GraphEvent;
import com.knowledgeengine.model.graph.GraphWarning;
import com.knowledgeengine.model.graph.ImportOutcome;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.NodeUri;
import com.knowledgeengine.model.graph.TraversalResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Expands the Active Context from a seed node.
 *
 * Runs {@link CostBoundedSearch} over the local store, fetching nodes of remote
 * workspaces on the way, then touches every accepted node into the context so
 * that the seed ends up most recently used.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TraversalEngine {

    private final GraphStore graphStore;
    private final WorkspaceRegistry workspaceRegistry;
    private final RemoteSubgraphService remoteSubgraphService;
    private final ActiveContext activeContext;
    private final ChangeNotifier changeNotifier;
    private final KnowledgeProperties properties;

    /**
     * @param maxCost cost ceiling, defaults to {@code knowledge.traversal.default-max-cost}
     * @param cap maximum accepted nodes, defaults to the context cap
     * @throws NotFoundException if the seed exists neither locally nor after a remote fetch
     */
    public Mono<TraversalResult> traverse(String seedUri, Double maxCost, Integer cap) {
        return Mono.defer(() -> {
            NodeUri seed = NodeUri.parse(seedUri);
            double budget = maxCost == null ? properties.getTraversal().getDefaultMaxCost() : maxCost;
            if (Double.isNaN(budget) || budget < 0) {
                return Mono.error(new InvalidRequestException("maxCost must be a non-negative number, got " + maxCost));
            }
            int limit = cap == null ? activeContext.getCap() : cap;
            if (limit <= 0) {
                return Mono.error(new InvalidRequestException("Context size cap must be positive, got " + cap));
            }

            List<GraphWarning> seedWarnings = Collections.synchronizedList(new ArrayList<>());
            return ensureSeed(seedUri, seedWarnings)
                    .then(new CostBoundedSearch(graphStore).search(seedUri, budget, limit, new RemoteCrossing(seed)))
                    .map(result -> {
                        List<GraphWarning> fromSeed = seedWarnings.stream()
                                .filter(warning -> !result.getWarnings().contains(warning))
                                .collect(Collectors.toList());
                        result.getWarnings().addAll(0, fromSeed);
                        updateContext(result);
                        return result;
                    });
        });
    }

    private Mono<Node> ensureSeed(String seedUri, List<GraphWarning> warnings) {
        return graphStore.getNode(seedUri)
                .switchIfEmpty(Mono.defer(() -> {
                    if (!workspaceRegistry.isRemoteUri(seedUri)) {
                        return Mono.empty();
                    }
                    return remoteSubgraphService.fetch(seedUri)
                            .doOnNext(outcome -> warnings.addAll(conflictWarnings(outcome)))
                            .onErrorResume(RemoteUnavailableException.class, error -> {
                                log.warn("Seed {} could not be fetched: {}", seedUri, error.getMessage());
                                return Mono.empty();
                            })
                            .then(graphStore.getNode(seedUri));
                }))
                .switchIfEmpty(Mono.error(new NotFoundException("Node", seedUri)));
    }

    private void updateContext(TraversalResult result) {
        List<String> accepted = new ArrayList<>(result.acceptedUris());
        Collections.reverse(accepted);
        List<String> evicted = activeContext.touchAll(accepted);
        log.info("Traversal from {} accepted {} node(s); evicted {} from context",
                result.getSeedUri(), accepted.size(), evicted.size());
        changeNotifier.publish(GraphEvent.contextUpdated(activeContext.members()));
    }

    private static List<GraphWarning> conflictWarnings(ImportOutcome outcome) {
        return outcome.getConflicts().stream()
                .map(ConflictReport::getUri)
                .map(GraphWarning::remoteConflict)
                .collect(Collectors.toList());
    }

    /**
     * Fetches absent nodes of registered remote workspaces other than the seed's,
     * including further hops inside a remote workspace already entered.
     */
    private final class RemoteCrossing implements WorkspaceCrossing {

        private final NodeUri seed;

        private RemoteCrossing(NodeUri seed) {
            this.seed = seed;
        }

        @Override
        public boolean crosses(String fromUri, String toUri) {
            if (fromUri == null) {
                return false;
            }
            return NodeUri.tryParse(toUri)
                    .filter(to -> workspaceRegistry.isRemote(to.getWorkspaceId()))
                    .map(to -> !seed.sameWorkspace(to))
                    .orElse(false);
        }

        @Override
        public Mono<Materialization> materialize(String uri) {
            return remoteSubgraphService.fetch(uri)
                    .map(outcome -> Materialization.available(conflictWarnings(outcome)))
                    .onErrorResume(error -> {
                        log.warn("Pruning path into {}: {}", uri, error.getMessage());
                        return Mono.just(Materialization.unavailable(
                                List.of(GraphWarning.remoteUnavailable(uri, error.getMessage()))));
                    });
        }
    }
}
