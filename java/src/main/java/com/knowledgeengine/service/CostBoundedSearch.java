package com.knowledgeengine.service;

import com.knowledgeengine.model.graph.GraphWarning;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.NodeType;
import com.knowledgeengine.model.graph.NodeUri;
import com.knowledgeengine.model.graph.Relation;
import com.knowledgeengine.model.graph.TraversalResult;
import com.knowledgeengine.model.graph.TraversedNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Weighted breadth-first expansion from a seed under a cost ceiling.
 *
 * <p>Candidates are accepted cheapest first; ties go to the earlier discovery.
 * A relation of weight 0 admits its target as soon as its source is accepted,
 * ahead of any queued candidate. At most {@code cap} nodes are accepted.
 * Targets that do not exist are skipped with a warning.</p>
 *
 * <p>The search only reads through a {@link GraphReader}; crossing into another
 * workspace is delegated to a {@link WorkspaceCrossing}.</p>
 */
@Slf4j
public class CostBoundedSearch {

    static final double EPSILON = 1e-9;

    private final GraphReader reader;

    public CostBoundedSearch(GraphReader reader) {
        this.reader = reader;
    }

    public Mono<TraversalResult> search(String seedUri, double maxCost, int cap, WorkspaceCrossing crossing) {
        return Mono.defer(() -> {
            State state = new State(seedUri, maxCost, cap, crossing);
            return Mono.just(state)
                    .expand(State::advance)
                    .then(Mono.fromSupplier(state::result));
        });
    }

    private static final class Candidate {
        private final String uri;
        private final String parentUri;
        private final double cost;
        private final long sequence;

        private Candidate(String uri, String parentUri, double cost, long sequence) {
            this.uri = uri;
            this.parentUri = parentUri;
            this.cost = cost;
            this.sequence = sequence;
        }
    }

    private final class State {
        private final String seedUri;
        private final double maxCost;
        private final int cap;
        private final WorkspaceCrossing crossing;

        private final PriorityQueue<Candidate> frontier = new PriorityQueue<>(
                Comparator.<Candidate>comparingDouble(candidate -> candidate.cost)
                        .thenComparingLong(candidate -> candidate.sequence));
        private final Deque<Candidate> zeroQueue = new ArrayDeque<>();
        private final Map<String, Double> best = new HashMap<>();
        private final Map<String, TraversedNode> accepted = new LinkedHashMap<>();
        private final Map<String, List<Relation>> outgoing = new HashMap<>();
        private final Set<String> rejected = new HashSet<>();
        private final Set<GraphWarning> warnings = new LinkedHashSet<>();
        private long sequence;

        private State(String seedUri, double maxCost, int cap, WorkspaceCrossing crossing) {
            this.seedUri = seedUri;
            this.maxCost = maxCost;
            this.cap = cap;
            this.crossing = crossing;
            best.put(seedUri, 0.0);
            frontier.add(new Candidate(seedUri, null, 0.0, sequence++));
        }

        /**
         * Process one candidate. Emits this state to continue, completes empty when done.
         */
        private Mono<State> advance() {
            if (accepted.size() >= cap) {
                return Mono.empty();
            }
            Candidate next = zeroQueue.isEmpty() ? frontier.poll() : zeroQueue.poll();
            if (next == null) {
                return Mono.empty();
            }
            if (accepted.containsKey(next.uri) || rejected.contains(next.uri) || isStale(next)) {
                return Mono.just(this);
            }
            return resolve(next)
                    .flatMap(node -> accept(next, node))
                    .defaultIfEmpty(this);
        }

        private boolean isStale(Candidate candidate) {
            Double known = best.get(candidate.uri);
            return known != null && candidate.cost > known + EPSILON;
        }

        private Mono<Node> resolve(Candidate candidate) {
            return reader.getNode(candidate.uri)
                    .switchIfEmpty(Mono.defer(() -> crossing.crosses(candidate.parentUri, candidate.uri)
                            ? fetchAcross(candidate.uri)
                            : Mono.empty()))
                    .switchIfEmpty(Mono.fromRunnable(() -> markMissing(candidate.uri)));
        }

        private Mono<Node> fetchAcross(String uri) {
            return crossing.materialize(uri)
                    .flatMap(materialization -> {
                        warnings.addAll(materialization.getWarnings());
                        if (!materialization.isAvailable()) {
                            rejected.add(uri);
                            return Mono.empty();
                        }
                        return reader.getNode(uri)
                                .switchIfEmpty(Mono.fromRunnable(() -> {
                                    if (rejected.add(uri)) {
                                        warnings.add(GraphWarning.danglingReference(uri));
                                    }
                                }));
                    });
        }

        private void markMissing(String uri) {
            if (!rejected.add(uri)) {
                return;
            }
            boolean resource = NodeUri.tryParse(uri)
                    .map(parsed -> parsed.getNodeType() == NodeType.RESOURCE)
                    .orElse(false);
            warnings.add(resource ? GraphWarning.danglingReference(uri) : GraphWarning.danglingConcept(uri));
        }

        private Mono<State> accept(Candidate candidate, Node node) {
            accepted.put(candidate.uri, new TraversedNode(node, candidate.cost));
            return reader.getOutgoing(candidate.uri)
                    .collectList()
                    .map(relations -> {
                        outgoing.put(candidate.uri, relations);
                        for (Relation relation : relations) {
                            offer(candidate, relation);
                        }
                        return this;
                    });
        }

        private void offer(Candidate from, Relation relation) {
            String target = relation.getTargetUri();
            if (target.equals(from.uri) || accepted.containsKey(target) || rejected.contains(target)) {
                return;
            }
            double newCost = from.cost + relation.getWeight();
            if (newCost > maxCost + EPSILON) {
                return;
            }
            Double known = best.get(target);
            if (known != null && known <= newCost + EPSILON) {
                return;
            }
            best.put(target, newCost);
            Candidate candidate = new Candidate(target, from.uri, newCost, sequence++);
            if (relation.getWeight() == 0.0) {
                zeroQueue.add(candidate);
            } else {
                frontier.add(candidate);
            }
        }

        private TraversalResult result() {
            List<Relation> edges = new ArrayList<>();
            for (String uri : accepted.keySet()) {
                for (Relation relation : outgoing.getOrDefault(uri, List.of())) {
                    if (accepted.containsKey(relation.getTargetUri())) {
                        edges.add(relation);
                    }
                }
            }
            log.debug("Search from {} accepted {} node(s), {} edge(s), {} warning(s)",
                    seedUri, accepted.size(), edges.size(), warnings.size());
            return TraversalResult.builder()
                    .seedUri(seedUri)
                    .maxCost(maxCost)
                    .nodes(new ArrayList<>(accepted.values()))
                    .edges(edges)
                    .warnings(new ArrayList<>(warnings))
                    .build();
        }
    }
}
