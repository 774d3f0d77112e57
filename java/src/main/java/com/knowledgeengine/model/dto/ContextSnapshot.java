package com.knowledgeengine.model.dto;

import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.Relation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Active Context members, most recent first, with their nodes and the edges among them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextSnapshot {
    private List<String> members;
    private List<Node> nodes;
    private List<Relation> relations;
    private int cap;
}
