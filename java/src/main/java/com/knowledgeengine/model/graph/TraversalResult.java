package com.knowledgeengine.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Accepted nodes in acceptance order, the edges among them and collected warnings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversalResult {
    private String seedUri;
    private double maxCost;

    @Builder.Default
    private List<TraversedNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<Relation> edges = new ArrayList<>();

    @Builder.Default
    private List<GraphWarning> warnings = new ArrayList<>();

    public List<String> acceptedUris() {
        return nodes.stream()
                .map(traversed -> traversed.getNode().getUri())
                .collect(Collectors.toList());
    }

    public Subgraph toSubgraph() {
        return Subgraph.builder()
                .seedUri(seedUri)
                .nodes(nodes.stream().map(TraversedNode::getNode).collect(Collectors.toList()))
                .relations(new ArrayList<>(edges))
                .build();
    }
}
