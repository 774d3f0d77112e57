package com.knowledgeengine.service;

import com.knowledgeengine.exception.InvalidRequestException;
import com.knowledgeengine.exception.NotFoundException;
import com.knowledgeengine.model.graph.ConflictChoice;
import com.knowledgeengine.model.graph.ConflictReport;
import com.knowledgeengine.model.graph.ImportOutcome;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.Relation;
import com.knowledgeengine.model.graph.Subgraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Imports fetched subgraphs and keeps the conflicts they raise until someone resolves them.
 *
 * A fetched node that differs from its local copy is never merged automatically.
 * The comparison itself happens in {@link GraphStore#importAll} under the write gate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConflictResolver {

    private final GraphStore graphStore;

    private final Map<String, ConflictReport> outstanding = new ConcurrentHashMap<>();

    /**
     * Import a fetched subgraph: absent nodes and relations are inserted, identical nodes are
     * left alone, divergent nodes produce a {@link ConflictReport} and keep their local version.
     */
    public Mono<ImportOutcome> importSubgraph(Subgraph subgraph) {
        List<Node> fetched = subgraph.getNodes() == null ? List.of() : subgraph.getNodes();
        List<Relation> relations = subgraph.getRelations() == null ? List.of() : subgraph.getRelations();

        return graphStore.importAll(fetched, relations)
                .doOnNext(outcome -> {
                    outcome.setUri(subgraph.getSeedUri());
                    outcome.getConflicts().forEach(report -> {
                        log.warn("Conflict on {}: fetched version differs from local copy", report.getUri());
                        outstanding.put(report.getUri(), report);
                    });
                    log.info("Imported {} node(s) and {} relation(s) from remote, {} unchanged, {} conflict(s)",
                            outcome.getImported().size(), outcome.getImportedRelations(),
                            outcome.getUnchanged().size(), outcome.getConflicts().size());
                });
    }

    public List<ConflictReport> listConflicts() {
        return outstanding.values().stream()
                .sorted(Comparator.comparing(ConflictReport::getDetectedAt))
                .collect(Collectors.toList());
    }

    public boolean hasConflict(String uri) {
        return outstanding.containsKey(uri);
    }

    /**
     * Settle an outstanding conflict.
     *
     * @param merged replacement attributes, required for {@link ConflictChoice#MERGED}
     * @return the local node after resolution
     * @throws NotFoundException if no conflict is outstanding for the URI
     */
    public Mono<Node> resolve(String uri, ConflictChoice choice, Node merged) {
        return Mono.defer(() -> {
            ConflictReport report = outstanding.get(uri);
            if (report == null) {
                return Mono.error(new NotFoundException("Conflict", uri));
            }
            if (choice == null) {
                return Mono.error(new InvalidRequestException("A resolution choice is required"));
            }
            Mono<Node> resolution;
            switch (choice) {
                case KEEP_LOCAL:
                    resolution = graphStore.requireNode(uri);
                    break;
                case TAKE_REMOTE:
                    Node remote = report.getRemote();
                    resolution = graphStore.overwriteNode(uri, remote.getName(), remote.getContent(), remote.getMetadata());
                    break;
                case MERGED:
                    if (merged == null) {
                        return Mono.error(new InvalidRequestException("MERGED resolution requires the merged node"));
                    }
                    resolution = graphStore.overwriteNode(uri, merged.getName(), merged.getContent(), merged.getMetadata());
                    break;
                default:
                    return Mono.error(new InvalidRequestException("Unsupported choice " + choice));
            }
            return resolution.doOnNext(node -> {
                outstanding.remove(uri, report);
                log.info("Resolved conflict on {} with {}", uri, choice);
            });
        });
    }
}
