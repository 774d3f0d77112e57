package com.knowledgeengine.model.graph;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A concept or resource node as read from the store.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Node {
    private String uri;
    private NodeType nodeType;
    private String name;
    private String content;
    private ObjectNode metadata;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
