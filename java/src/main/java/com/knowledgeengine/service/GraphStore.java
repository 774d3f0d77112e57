package com.knowledgeengine.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledgeengine.exception.DuplicateUriException;
import com.knowledgeengine.exception.InvalidRequestException;
import com.knowledgeengine.exception.NotFoundException;
import com.knowledgeengine.model.entity.NodeEntity;
import com.knowledgeengine.model.entity.RelationEntity;
import com.knowledgeengine.model.graph.ConflictReport;
import com.knowledgeengine.model.graph.GraphEvent;
import com.knowledgeengine.model.graph.ImportOutcome;
import com.knowledgeengine.model.graph.LinkOutcome;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.NodeType;
import com.knowledgeengine.model.graph.NodeUri;
import com.knowledgeengine.model.graph.Relation;
import com.knowledgeengine.repository.NodeRepository;
import com.knowledgeengine.repository.RelationRepository;
import com.knowledgeengine.util.GraphMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Durable store of nodes and relations keyed by URI.
 *
 * Reads go straight to the repositories. Every mutation passes through the
 * {@link GraphWriteGate} and publishes its change event once committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphStore implements GraphReader {

    private final NodeRepository nodeRepository;
    private final RelationRepository relationRepository;
    private final LinkResolver linkResolver;
    private final GraphMapper graphMapper;
    private final GraphWriteGate writeGate;
    private final ChangeNotifier changeNotifier;

    // ---- reads ----

    @Override
    public Mono<Node> getNode(String uri) {
        return nodeRepository.findByUri(uri).map(graphMapper::toNode);
    }

    public Mono<Node> requireNode(String uri) {
        return getNode(uri).switchIfEmpty(Mono.error(new NotFoundException("Node", uri)));
    }

    public Mono<Boolean> exists(String uri) {
        return nodeRepository.existsByUri(uri);
    }

    public Flux<Node> getNodes(Collection<String> uris) {
        if (uris.isEmpty()) {
            return Flux.empty();
        }
        return nodeRepository.findByUriIn(uris).map(graphMapper::toNode);
    }

    @Override
    public Flux<Relation> getOutgoing(String uri) {
        return relationRepository.findOutgoing(uri).map(graphMapper::toRelation);
    }

    public Flux<Relation> getIncoming(String uri) {
        return relationRepository.findIncoming(uri).map(graphMapper::toRelation);
    }

    /**
     * Relations with both endpoints in {@code uris}.
     */
    public Flux<Relation> getRelationsAmong(Collection<String> uris) {
        if (uris.isEmpty()) {
            return Flux.empty();
        }
        return relationRepository.findAmong(uris).map(graphMapper::toRelation);
    }

    public Mono<Long> countNodes() {
        return nodeRepository.count();
    }

    public Mono<Long> countRelations() {
        return relationRepository.countAll();
    }

    // ---- node mutations ----

    /**
     * Create a node.
     *
     * @throws DuplicateUriException if the URI is taken
     * @throws InvalidRequestException if the type does not match the scheme, or a resource carries name or content
     */
    public Mono<Node> createNode(String uri, NodeType type, String name, String content, ObjectNode metadata) {
        return Mono.defer(() -> {
            NodeUri parsed = NodeUri.parse(uri);
            if (type != null && type != parsed.getNodeType()) {
                return Mono.error(new InvalidRequestException(
                        "Node type '" + type.getScheme() + "' does not match URI scheme of " + uri));
            }
            checkResourceAttributes(parsed, name, content);

            return writeGate.write(() -> nodeRepository.existsByUri(uri)
                    .flatMap(exists -> {
                        if (exists) {
                            return Mono.<Node>error(new DuplicateUriException("Node", uri));
                        }
                        LocalDateTime now = LocalDateTime.now();
                        NodeEntity entity = NodeEntity.builder()
                                .uri(uri)
                                .nodeType(parsed.getNodeType().getScheme())
                                .name(name)
                                .content(content)
                                .metadata(graphMapper.writeMetadata(metadata))
                                .createdAt(now)
                                .updatedAt(now)
                                .build();
                        return nodeRepository.save(entity).map(graphMapper::toNode);
                    }));
        })
        .doOnNext(node -> {
            log.info("Created {} {}", node.getNodeType().getScheme(), node.getUri());
            changeNotifier.publish(GraphEvent.nodeAdded(node));
        });
    }

    /**
     * Update attributes of an existing node. Null arguments leave the field unchanged.
     */
    public Mono<Node> updateNode(String uri, String name, String content, ObjectNode metadata) {
        return Mono.defer(() -> {
            NodeUri parsed = NodeUri.parse(uri);
            checkResourceAttributes(parsed, name, content);
            return writeGate.write(() -> findEntity(uri)
                    .flatMap(entity -> {
                        if (name != null) {
                            entity.setName(name);
                        }
                        if (content != null) {
                            entity.setContent(content);
                        }
                        if (metadata != null) {
                            entity.setMetadata(graphMapper.writeMetadata(metadata));
                        }
                        entity.setUpdatedAt(LocalDateTime.now());
                        return nodeRepository.save(entity).map(graphMapper::toNode);
                    }));
        })
        .doOnNext(node -> changeNotifier.publish(GraphEvent.nodeUpdated(node)));
    }

    /**
     * Replace every attribute of an existing node, nulls included.
     */
    public Mono<Node> overwriteNode(String uri, String name, String content, ObjectNode metadata) {
        return Mono.defer(() -> {
            NodeUri parsed = NodeUri.parse(uri);
            checkResourceAttributes(parsed, name, content);
            return writeGate.write(() -> findEntity(uri)
                    .flatMap(entity -> {
                        entity.setName(name);
                        entity.setContent(content);
                        entity.setMetadata(graphMapper.writeMetadata(metadata));
                        entity.setUpdatedAt(LocalDateTime.now());
                        return nodeRepository.save(entity).map(graphMapper::toNode);
                    }));
        })
        .doOnNext(node -> changeNotifier.publish(GraphEvent.nodeUpdated(node)));
    }

    /**
     * Rename a node and rewrite every relation that references it, atomically.
     *
     * An incident relation that would collide with an existing relation under the
     * new URI is dropped in favour of the existing one.
     */
    public Mono<Node> moveNode(String oldUri, String newUri) {
        return Mono.defer(() -> {
            NodeUri from = NodeUri.parse(oldUri);
            NodeUri to = NodeUri.parse(newUri);
            if (from.getNodeType() != to.getNodeType()) {
                return Mono.error(new InvalidRequestException(
                        "Cannot move " + oldUri + " to a different scheme: " + newUri));
            }
            if (oldUri.equals(newUri)) {
                return requireNode(oldUri);
            }
            return writeGate.write(() -> findEntity(oldUri)
                    .flatMap(entity -> nodeRepository.existsByUri(newUri))
                    .flatMap(taken -> {
                        if (taken) {
                            return Mono.<Node>error(new DuplicateUriException("Node", newUri));
                        }
                        return dropCollidingRelations(oldUri, newUri)
                                .then(nodeRepository.renameUri(oldUri, newUri, LocalDateTime.now()))
                                .then(relationRepository.rewriteSource(oldUri, newUri))
                                .then(relationRepository.rewriteTarget(oldUri, newUri))
                                .then(nodeRepository.findByUri(newUri))
                                .map(graphMapper::toNode);
                    }))
                    .doOnNext(node -> {
                        log.info("Moved {} to {}", oldUri, newUri);
                        changeNotifier.publish(GraphEvent.nodeMoved(oldUri, node));
                    });
        });
    }

    private Mono<Void> dropCollidingRelations(String oldUri, String newUri) {
        Set<String> claimed = new HashSet<>();
        return relationRepository.findIncident(oldUri)
                .concatMap(relation -> {
                    String source = relation.getSourceUri().equals(oldUri) ? newUri : relation.getSourceUri();
                    String target = relation.getTargetUri().equals(oldUri) ? newUri : relation.getTargetUri();
                    String key = source + "\n" + target + "\n" + relation.getRelationType();
                    if (!claimed.add(key)) {
                        return relationRepository.deleteById(relation.getId());
                    }
                    return relationRepository.findBySourceUriAndTargetUriAndRelationType(source, target, relation.getRelationType())
                            .flatMap(existing -> {
                                log.debug("Dropping relation {} superseded by {} after move", relation.getId(), existing.getId());
                                return relationRepository.deleteById(relation.getId());
                            });
                })
                .then();
    }

    /**
     * Delete a node and every relation where it is source or target.
     *
     * @return whether a node was deleted; deleting an absent node is a no-op
     */
    public Mono<Boolean> deleteNode(String uri) {
        return writeGate.write(() -> nodeRepository.existsByUri(uri)
                .flatMap(exists -> {
                    if (!exists) {
                        return Mono.just(false);
                    }
                    return relationRepository.deleteIncident(uri)
                            .then(nodeRepository.deleteByUri(uri))
                            .map(deleted -> deleted > 0);
                }))
                .doOnNext(deleted -> {
                    if (deleted) {
                        log.info("Deleted node {}", uri);
                        changeNotifier.publish(GraphEvent.nodeRemoved(uri));
                    }
                });
    }

    // ---- relation mutations ----

    /**
     * Insert or update the relation identified by (source, target, type) and resolve both endpoints.
     */
    public Mono<LinkOutcome> link(String sourceUri, String targetUri, String relationType, Double weight, ObjectNode metadata) {
        return Mono.defer(() -> {
            NodeUri.parse(sourceUri);
            NodeUri.parse(targetUri);
            checkRelationType(relationType);
            double effectiveWeight = checkWeight(weight);

            return writeGate.write(() -> {
                LinkOutcome outcome = new LinkOutcome();
                return linkResolver.resolve(targetUri, sourceUri)
                        .concatWith(linkResolver.resolve(sourceUri, targetUri))
                        .doOnNext(resolution -> {
                            if (resolution.getCreated() != null) {
                                outcome.getCreatedNodes().add(resolution.getCreated());
                            }
                            if (resolution.getWarning() != null && !outcome.getWarnings().contains(resolution.getWarning())) {
                                outcome.getWarnings().add(resolution.getWarning());
                            }
                        })
                        .then(upsertRelation(sourceUri, targetUri, relationType, effectiveWeight, metadata))
                        .map(relation -> {
                            outcome.setRelation(relation);
                            return outcome;
                        });
            });
        })
        .doOnNext(outcome -> {
            outcome.getCreatedNodes().forEach(node -> changeNotifier.publish(GraphEvent.nodeAdded(node)));
            changeNotifier.publish(GraphEvent.relationAdded(outcome.getRelation()));
        });
    }

    private Mono<Relation> upsertRelation(String sourceUri, String targetUri, String relationType,
                                          double weight, ObjectNode metadata) {
        return relationRepository.findBySourceUriAndTargetUriAndRelationType(sourceUri, targetUri, relationType)
                .map(existing -> {
                    existing.setWeight(weight);
                    if (metadata != null) {
                        existing.setMetadata(graphMapper.writeMetadata(metadata));
                    }
                    return existing;
                })
                .switchIfEmpty(Mono.fromSupplier(() -> RelationEntity.builder()
                        .sourceUri(sourceUri)
                        .targetUri(targetUri)
                        .relationType(relationType)
                        .weight(weight)
                        .metadata(graphMapper.writeMetadata(metadata))
                        .createdAt(LocalDateTime.now())
                        .build()))
                .flatMap(relationRepository::save)
                .map(graphMapper::toRelation);
    }

    /**
     * Delete a relation if present.
     *
     * @return whether a relation was deleted
     */
    public Mono<Boolean> unlink(String sourceUri, String targetUri, String relationType) {
        return writeGate.write(() -> relationRepository.findBySourceUriAndTargetUriAndRelationType(sourceUri, targetUri, relationType)
                .flatMap(existing -> relationRepository.deleteById(existing.getId())
                        .thenReturn(graphMapper.toRelation(existing))))
                .doOnNext(removed -> changeNotifier.publish(GraphEvent.relationRemoved(removed)))
                .map(removed -> true)
                .defaultIfEmpty(false);
    }

    // ---- remote import ----

    /**
     * Import fetched nodes and relations. Absent rows are inserted; existing rows are never
     * overwritten. Each fetched node is compared with its local copy in the same transaction
     * as the inserts; a divergent copy becomes a {@link ConflictReport}.
     *
     * @return inserted nodes, unchanged URIs, conflicts and the number of inserted relations
     */
    public Mono<ImportOutcome> importAll(List<Node> nodes, List<Relation> relations) {
        return Mono.defer(() -> {
            for (Node node : nodes) {
                NodeUri parsed = NodeUri.parse(node.getUri());
                if (node.getNodeType() != null && node.getNodeType() != parsed.getNodeType()) {
                    return Mono.error(new InvalidRequestException("Imported node type does not match " + node.getUri()));
                }
            }
            for (Relation relation : relations) {
                NodeUri.parse(relation.getSourceUri());
                NodeUri.parse(relation.getTargetUri());
                checkRelationType(relation.getRelationType());
                checkWeight(relation.getWeight());
            }

            return writeGate.write(() -> {
                ImportOutcome outcome = new ImportOutcome();
                List<Relation> insertedRelations = new ArrayList<>();
                return Flux.fromIterable(nodes)
                        .concatMap(node -> importNode(node, outcome))
                        .thenMany(Flux.fromIterable(relations))
                        .concatMap(this::insertRelationIfAbsent)
                        .doOnNext(insertedRelations::add)
                        .then(Mono.fromSupplier(() -> {
                            outcome.setImportedRelations(insertedRelations.size());
                            return new ImportedRows(outcome, insertedRelations);
                        }));
            });
        })
        .doOnNext(rows -> {
            rows.outcome.getImported().forEach(node -> changeNotifier.publish(GraphEvent.nodeAdded(node)));
            rows.relations.forEach(relation -> changeNotifier.publish(GraphEvent.relationAdded(relation)));
        })
        .map(rows -> rows.outcome);
    }

    private Mono<Void> importNode(Node remote, ImportOutcome outcome) {
        return nodeRepository.findByUri(remote.getUri())
                .map(graphMapper::toNode)
                .doOnNext(local -> {
                    if (sameVersion(local, remote)) {
                        outcome.getUnchanged().add(remote.getUri());
                    } else {
                        outcome.getConflicts().add(ConflictReport.builder()
                                .uri(remote.getUri())
                                .local(local)
                                .remote(remote)
                                .detectedAt(LocalDateTime.now())
                                .build());
                    }
                })
                .switchIfEmpty(Mono.defer(() -> insertNode(remote).doOnNext(outcome.getImported()::add)))
                .then();
    }

    private Mono<Node> insertNode(Node node) {
        LocalDateTime now = LocalDateTime.now();
        NodeEntity entity = NodeEntity.builder()
                .uri(node.getUri())
                .nodeType(NodeUri.parse(node.getUri()).getNodeType().getScheme())
                .name(node.getName())
                .content(node.getContent())
                .metadata(graphMapper.writeMetadata(node.getMetadata()))
                .createdAt(Objects.requireNonNullElse(node.getCreatedAt(), now))
                .updatedAt(Objects.requireNonNullElse(node.getUpdatedAt(), now))
                .build();
        return nodeRepository.save(entity).map(graphMapper::toNode);
    }

    private boolean sameVersion(Node local, Node remote) {
        return Objects.equals(local.getName(), remote.getName())
                && Objects.equals(local.getContent(), remote.getContent())
                && graphMapper.sameMetadata(local.getMetadata(), remote.getMetadata());
    }

    private Mono<Relation> insertRelationIfAbsent(Relation relation) {
        return relationRepository.findBySourceUriAndTargetUriAndRelationType(
                        relation.getSourceUri(), relation.getTargetUri(), relation.getRelationType())
                .hasElement()
                .filter(exists -> !exists)
                .flatMap(absent -> relationRepository.save(RelationEntity.builder()
                        .sourceUri(relation.getSourceUri())
                        .targetUri(relation.getTargetUri())
                        .relationType(relation.getRelationType())
                        .weight(relation.getWeight())
                        .metadata(graphMapper.writeMetadata(relation.getMetadata()))
                        .createdAt(LocalDateTime.now())
                        .build()))
                .map(graphMapper::toRelation);
    }

    // ---- helpers ----

    private Mono<NodeEntity> findEntity(String uri) {
        return nodeRepository.findByUri(uri)
                .switchIfEmpty(Mono.error(new NotFoundException("Node", uri)));
    }

    private static void checkResourceAttributes(NodeUri uri, String name, String content) {
        if (uri.getNodeType() == NodeType.RESOURCE && (name != null || content != null)) {
            throw new InvalidRequestException("Resource " + uri + " cannot carry a name or content");
        }
    }

    private static void checkRelationType(String relationType) {
        if (relationType == null || relationType.isBlank()) {
            throw new InvalidRequestException("Relation type is required");
        }
    }

    static double checkWeight(Double weight) {
        if (weight == null) {
            return 1.0;
        }
        if (weight.isNaN() || weight < 0.0 || weight > 1.0) {
            throw new InvalidRequestException("Relation weight must be within [0, 1], got " + weight);
        }
        return weight;
    }

    private static final class ImportedRows {
        private final ImportOutcome outcome;
        private final List<Relation> relations;

        private ImportedRows(ImportOutcome outcome, List<Relation> relations) {
            this.outcome = outcome;
            this.relations = relations;
        }
    }
}
