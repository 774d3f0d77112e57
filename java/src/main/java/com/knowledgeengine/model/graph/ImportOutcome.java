package com.knowledgeengine.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of importing a fetched subgraph into the local store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportOutcome {
    private String uri;

    @Builder.Default
    private List<Node> imported = new ArrayList<>();

    @Builder.Default
    private List<String> unchanged = new ArrayList<>();

    @Builder.Default
    private List<ConflictReport> conflicts = new ArrayList<>();

    private int importedRelations;
}
