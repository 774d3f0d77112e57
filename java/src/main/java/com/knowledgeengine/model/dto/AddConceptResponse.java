package com.knowledgeengine.model.dto;

import com.knowledgeengine.model.graph.GraphWarning;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.Relation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Created concept, the relations created with it and any warnings raised on the way.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddConceptResponse {
    private Node node;

    @Builder.Default
    private List<Relation> relations = new ArrayList<>();

    @Builder.Default
    private List<GraphWarning> warnings = new ArrayList<>();
}
