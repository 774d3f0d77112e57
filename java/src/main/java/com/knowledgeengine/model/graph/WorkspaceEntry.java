package com.knowledgeengine.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Workspace registry entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkspaceEntry {
    private String id;
    private WorkspaceStrategy strategy;
    private String r2dbcUrl;
    private String endpoint;

    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String apiKey;
}
