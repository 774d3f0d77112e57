package com.knowledgeengine.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Node accepted by a traversal together with the cost it was reached at.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversedNode {
    private Node node;
    private double cost;
}
