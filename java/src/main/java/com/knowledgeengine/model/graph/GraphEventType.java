package com.knowledgeengine.model.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Change event kinds delivered to observers.
 */
public enum GraphEventType {
    NODE_ADDED("node_added"),
    NODE_UPDATED("node_updated"),
    NODE_REMOVED("node_removed"),
    RELATION_ADDED("relation_added"),
    RELATION_REMOVED("relation_removed"),
    CONTEXT_UPDATED("context_updated");

    private final String wireName;

    GraphEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
