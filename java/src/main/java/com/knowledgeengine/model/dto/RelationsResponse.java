package com.knowledgeengine.model.dto;

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
public class RelationsResponse {
    private String uri;
    private List<Relation> outgoing;
    private List<Relation> incoming;
}
