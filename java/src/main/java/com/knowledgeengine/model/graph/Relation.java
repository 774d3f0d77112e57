package com.knowledgeengine.model.graph;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Directed, weighted edge. Unique per (sourceUri, targetUri, relationType).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Relation {
    private String sourceUri;
    private String targetUri;
    private String relationType;
    @Builder.Default
    private double weight = 1.0;
    private ObjectNode metadata;
    private LocalDateTime createdAt;
}
