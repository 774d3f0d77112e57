package com.knowledgeengine.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Serialized node and edge set handed between workspaces.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subgraph {
    private String seedUri;

    @Builder.Default
    private List<Node> nodes = new ArrayList<>();

    @Builder.Default
    private List<Relation> relations = new ArrayList<>();
}
