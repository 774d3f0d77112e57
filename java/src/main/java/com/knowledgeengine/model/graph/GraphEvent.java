package com.knowledgeengine.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A committed graph mutation or an Active Context change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphEvent {
    private GraphEventType type;
    private String uri;
    private Object payload;
    private LocalDateTime timestamp;

    public static GraphEvent nodeAdded(Node node) {
        return of(GraphEventType.NODE_ADDED, node.getUri(), node);
    }

    public static GraphEvent nodeUpdated(Node node) {
        return of(GraphEventType.NODE_UPDATED, node.getUri(), node);
    }

    /**
     * A move is reported as an update whose uri is the previous one.
     */
    public static GraphEvent nodeMoved(String oldUri, Node node) {
        return of(GraphEventType.NODE_UPDATED, oldUri, node);
    }

    public static GraphEvent nodeRemoved(String uri) {
        return of(GraphEventType.NODE_REMOVED, uri, null);
    }

    public static GraphEvent relationAdded(Relation relation) {
        return of(GraphEventType.RELATION_ADDED, relation.getSourceUri(), relation);
    }

    public static GraphEvent relationRemoved(Relation relation) {
        return of(GraphEventType.RELATION_REMOVED, relation.getSourceUri(), relation);
    }

    public static GraphEvent contextUpdated(List<String> members) {
        return of(GraphEventType.CONTEXT_UPDATED, null, members);
    }

    private static GraphEvent of(GraphEventType type, String uri, Object payload) {
        return new GraphEvent(type, uri, payload, LocalDateTime.now());
    }
}
