package com.knowledgeengine.model.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.knowledgeengine.exception.InvalidRequestException;

/**
 * Kind of a graph node. The value doubles as the URI scheme.
 */
public enum NodeType {

    CONCEPT("concept"),
    RESOURCE("resource");

    private final String scheme;

    NodeType(String scheme) {
        this.scheme = scheme;
    }

    @JsonValue
    public String getScheme() {
        return scheme;
    }

    @JsonCreator
    public static NodeType fromScheme(String value) {
        for (NodeType type : values()) {
            if (type.scheme.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new InvalidRequestException("Unknown node type: " + value);
    }
}
