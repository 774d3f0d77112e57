package com.knowledgeengine.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledgeengine.config.KnowledgeProperties;
import com.knowledgeengine.exception.InvalidRequestException;
import com.knowledgeengine.model.dto.AddConceptResponse;
import com.knowledgeengine.model.dto.ConceptCreateRequest;
import com.knowledgeengine.model.dto.ConceptUpdateRequest;
import com.knowledgeengine.model.dto.ConflictResolveRequest;
import com.knowledgeengine.model.dto.ContextSnapshot;
import com.knowledgeengine.model.dto.ContextStatus;
import com.knowledgeengine.model.dto.LinkRequest;
import com.knowledgeengine.model.dto.MoveRequest;
import com.knowledgeengine.model.dto.NodeDetailsResponse;
import com.knowledgeengine.model.dto.RelationSpec;
import com.knowledgeengine.model.dto.RelationsResponse;
import com.knowledgeengine.model.dto.ResourceCreateRequest;
import com.knowledgeengine.model.dto.StatsResponse;
import com.knowledgeengine.model.dto.TraverseRequest;
import com.knowledgeengine.model.graph.ConflictChoice;
import com.knowledgeengine.model.graph.ConflictReport;
import com.knowledgeengine.model.graph.GraphEvent;
import com.knowledgeengine.model.graph.GraphWarning;
import com.knowledgeengine.model.graph.ImportOutcome;
import com.knowledgeengine.model.graph.LinkOutcome;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.NodeType;
import com.knowledgeengine.model.graph.NodeUri;
import com.knowledgeengine.model.graph.Subgraph;
import com.knowledgeengine.model.graph.TraversalResult;
import com.knowledgeengine.model.graph.WarningKind;
import com.knowledgeengine.util.MarkdownLinkExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point for every graph operation exposed to agents and the visualization client.
 *
 * Keeps the Active Context in step with edits: created, updated, read and linked nodes
 * are touched, deleted nodes evicted, moved nodes renamed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeGraphService {

    static final String REFERENCES = "references";

    private final GraphStore graphStore;
    private final LinkResolver linkResolver;
    private final TraversalEngine traversalEngine;
    private final ActiveContext activeContext;
    private final ChangeNotifier changeNotifier;
    private final ConflictResolver conflictResolver;
    private final RemoteSubgraphService remoteSubgraphService;
    private final WorkspaceRegistry workspaceRegistry;
    private final KnowledgeProperties properties;

    // ---- traversal and export ----

    public Mono<TraversalResult> traverse(TraverseRequest request) {
        return traversalEngine.traverse(request.getSeedUri(), request.getMaxCost(), request.getContextSizeCap());
    }

    /**
     * Subgraph around a local node for another workspace. Never fetches and never touches the context.
     */
    public Mono<Subgraph> exportSubgraph(String seedUri, Double maxCost) {
        return Mono.defer(() -> {
            NodeUri.parse(seedUri);
            double budget = maxCost == null ? properties.getRemote().getExportMaxCost() : maxCost;
            if (Double.isNaN(budget) || budget < 0) {
                return Mono.error(new InvalidRequestException("maxCost must be a non-negative number, got " + maxCost));
            }
            return graphStore.requireNode(seedUri)
                    .then(new CostBoundedSearch(graphStore)
                            .search(seedUri, budget, activeContext.getCap(), WorkspaceCrossing.NONE))
                    .map(TraversalResult::toSubgraph);
        });
    }

    public Mono<ImportOutcome> fetchRemoteSubgraph(String uri) {
        return remoteSubgraphService.fetch(uri);
    }

    // ---- concepts and resources ----

    /**
     * Create a concept, then link it to every explicit relation target and every
     * node its content links to in markdown.
     */
    public Mono<AddConceptResponse> addConcept(ConceptCreateRequest request) {
        return Mono.defer(() -> {
            NodeUri uri = NodeUri.parse(request.getUri());
            if (uri.getNodeType() != NodeType.CONCEPT) {
                return Mono.error(new InvalidRequestException("Concept URIs must use the concept scheme: " + request.getUri()));
            }
            List<RelationSpec> relations = relationsFor(request);
            relations.forEach(spec -> {
                NodeUri.parse(spec.getTargetUri());
                GraphStore.checkWeight(spec.getWeight());
            });

            AddConceptResponse response = new AddConceptResponse();
            return graphStore.createNode(request.getUri(), NodeType.CONCEPT, request.getName(), request.getContent(),
                            request.getMetadata())
                    .doOnNext(response::setNode)
                    .thenMany(Flux.fromIterable(relations))
                    .concatMap(spec -> link(request.getUri(), spec.getTargetUri(), spec.getRelationType(),
                            spec.getWeight(), spec.getMetadata()))
                    .doOnNext(outcome -> {
                        response.getRelations().add(outcome.getRelation());
                        outcome.getWarnings().stream()
                                .filter(warning -> !response.getWarnings().contains(warning))
                                .forEach(response.getWarnings()::add);
                    })
                    .then(Mono.fromSupplier(() -> {
                        activeContext.touch(request.getUri());
                        return response;
                    }));
        });
    }

    private List<RelationSpec> relationsFor(ConceptCreateRequest request) {
        List<RelationSpec> relations = new ArrayList<>();
        if (request.getRelations() != null) {
            relations.addAll(request.getRelations());
        }
        Set<String> explicitReferences = relations.stream()
                .filter(spec -> REFERENCES.equals(spec.getRelationType()))
                .map(RelationSpec::getTargetUri)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        for (String target : MarkdownLinkExtractor.extractTargets(request.getContent(), request.getUri())) {
            if (!explicitReferences.contains(target)) {
                relations.add(RelationSpec.builder().targetUri(target).relationType(REFERENCES).weight(1.0).build());
            }
        }
        return relations;
    }

    public Mono<Node> addResource(ResourceCreateRequest request) {
        return graphStore.createNode(request.getUri(), NodeType.RESOURCE, null, null, request.getMetadata())
                .doOnNext(node -> activeContext.touch(node.getUri()));
    }

    public Mono<Node> updateConcept(ConceptUpdateRequest request) {
        return graphStore.updateNode(request.getUri(), request.getName(), request.getContent(), request.getMetadata())
                .doOnNext(node -> activeContext.touch(node.getUri()));
    }

    public Mono<Node> moveConcept(MoveRequest request) {
        return graphStore.moveNode(request.getOldUri(), request.getNewUri())
                .doOnNext(node -> {
                    if (!activeContext.rename(request.getOldUri(), request.getNewUri())) {
                        activeContext.touch(request.getNewUri());
                    }
                });
    }

    public Mono<Boolean> deleteNode(String uri) {
        return graphStore.deleteNode(uri)
                .doOnNext(deleted -> activeContext.evict(uri));
    }

    /**
     * Node with its relations; the node becomes most recently used.
     */
    public Mono<NodeDetailsResponse> getNode(String uri) {
        return graphStore.requireNode(uri)
                .flatMap(node -> Mono.zip(graphStore.getOutgoing(uri).collectList(), graphStore.getIncoming(uri).collectList())
                        .map(relations -> NodeDetailsResponse.builder()
                                .node(node)
                                .outgoing(relations.getT1())
                                .incoming(relations.getT2())
                                .build()))
                .doOnNext(details -> activeContext.touch(uri));
    }

    public Mono<RelationsResponse> getRelations(String uri) {
        return Mono.zip(graphStore.getOutgoing(uri).collectList(), graphStore.getIncoming(uri).collectList())
                .map(relations -> RelationsResponse.builder()
                        .uri(uri)
                        .outgoing(relations.getT1())
                        .incoming(relations.getT2())
                        .build());
    }

    // ---- relations ----

    public Mono<LinkOutcome> link(LinkRequest request) {
        return link(request.getSourceUri(), request.getTargetUri(), request.getRelationType(),
                request.getWeight(), request.getMetadata());
    }

    /**
     * Remote endpoints are fetched before the write; a failed fetch becomes a warning.
     */
    private Mono<LinkOutcome> link(String sourceUri, String targetUri, String relationType, Double weight,
                                   ObjectNode metadata) {
        List<GraphWarning> fetchWarnings = new ArrayList<>();
        return prefetch(targetUri, sourceUri, fetchWarnings)
                .then(prefetch(sourceUri, targetUri, fetchWarnings))
                .then(graphStore.link(sourceUri, targetUri, relationType, weight, metadata))
                .map(outcome -> mergeWarnings(outcome, fetchWarnings))
                .flatMap(outcome -> touchExisting(sourceUri, targetUri).thenReturn(outcome));
    }

    private Mono<Void> prefetch(String anchorUri, String endpointUri, List<GraphWarning> warnings) {
        return linkResolver.needsRemoteFetch(anchorUri, endpointUri)
                .filter(Boolean::booleanValue)
                .flatMap(needed -> remoteSubgraphService.fetch(endpointUri)
                        .doOnNext(outcome -> outcome.getConflicts().stream()
                                .map(ConflictReport::getUri)
                                .map(GraphWarning::remoteConflict)
                                .forEach(warnings::add))
                        .onErrorResume(error -> {
                            warnings.add(GraphWarning.remoteUnavailable(endpointUri, error.getMessage()));
                            return Mono.empty();
                        }))
                .then();
    }

    private static LinkOutcome mergeWarnings(LinkOutcome outcome, List<GraphWarning> fetchWarnings) {
        Set<String> unavailable = fetchWarnings.stream()
                .filter(warning -> warning.getKind() == WarningKind.REMOTE_UNAVAILABLE)
                .map(GraphWarning::getUri)
                .collect(Collectors.toSet());
        List<GraphWarning> merged = new ArrayList<>(fetchWarnings);
        outcome.getWarnings().stream()
                .filter(warning -> !(warning.getKind() == WarningKind.DANGLING_REFERENCE && unavailable.contains(warning.getUri())))
                .filter(warning -> !merged.contains(warning))
                .forEach(merged::add);
        outcome.setWarnings(merged);
        return outcome;
    }

    private Mono<Void> touchExisting(String... uris) {
        return Flux.fromArray(uris)
                .distinct()
                .filterWhen(graphStore::exists)
                .collectList()
                .doOnNext(activeContext::touchAll)
                .then();
    }

    public Mono<Boolean> unlink(String sourceUri, String targetUri, String relationType) {
        return graphStore.unlink(sourceUri, targetUri, relationType)
                .flatMap(deleted -> touchExisting(sourceUri).thenReturn(deleted));
    }

    // ---- active context ----

    public Mono<ContextSnapshot> getActiveContext() {
        return activeContext.snapshot();
    }

    public Mono<ContextStatus> addToContext(String uri) {
        return graphStore.requireNode(uri)
                .map(node -> contextChanged(activeContext.touch(uri)));
    }

    public Mono<ContextStatus> evictFromContext(String uri) {
        return Mono.fromSupplier(() -> {
            List<String> evicted = activeContext.evict(uri) ? List.of(uri) : List.of();
            return contextChanged(evicted);
        });
    }

    public Mono<ContextStatus> clearContext() {
        return Mono.fromSupplier(() -> {
            List<String> evicted = activeContext.members();
            activeContext.clear();
            return contextChanged(evicted);
        });
    }

    private ContextStatus contextChanged(List<String> evicted) {
        List<String> members = activeContext.members();
        changeNotifier.publish(GraphEvent.contextUpdated(members));
        return ContextStatus.builder()
                .members(members)
                .evicted(evicted)
                .size(members.size())
                .cap(activeContext.getCap())
                .build();
    }

    // ---- conflicts ----

    public Flux<ConflictReport> listConflicts() {
        return Flux.fromIterable(conflictResolver.listConflicts());
    }

    public Mono<Node> resolveConflict(ConflictResolveRequest request) {
        Node merged = null;
        if (request.getChoice() == ConflictChoice.MERGED) {
            merged = Node.builder()
                    .uri(request.getUri())
                    .name(request.getName())
                    .content(request.getContent())
                    .metadata(request.getMetadata())
                    .build();
        }
        return conflictResolver.resolve(request.getUri(), request.getChoice(), merged);
    }

    // ---- events and statistics ----

    public Flux<GraphEvent> subscribe() {
        return changeNotifier.subscribe();
    }

    public Mono<StatsResponse> stats() {
        return Mono.zip(graphStore.countNodes(), graphStore.countRelations())
                .map(counts -> StatsResponse.builder()
                        .workspaceId(workspaceRegistry.getLocalWorkspaceId())
                        .nodeCount(counts.getT1())
                        .relationCount(counts.getT2())
                        .contextSize(activeContext.size())
                        .contextCap(activeContext.getCap())
                        .outstandingConflicts(conflictResolver.listConflicts().size())
                        .subscribers(changeNotifier.subscriberCount())
                        .build());
    }
}
