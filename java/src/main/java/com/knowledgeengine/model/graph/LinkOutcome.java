package com.knowledgeengine.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Stored relation plus the warnings raised while resolving its endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkOutcome {
    private Relation relation;

    @Builder.Default
    private List<GraphWarning> warnings = new ArrayList<>();

    /** Resource nodes created implicitly for missing endpoints. */
    @JsonIgnore
    @Builder.Default
    private List<Node> createdNodes = new ArrayList<>();
}
