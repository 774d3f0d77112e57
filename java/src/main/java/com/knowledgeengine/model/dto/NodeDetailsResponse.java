package com.knowledgeengine.model.dto;

import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.Relation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeDetailsResponse {
    private Node node;
    private List<Relation> outgoing;
    private List<Relation> incoming;
}
