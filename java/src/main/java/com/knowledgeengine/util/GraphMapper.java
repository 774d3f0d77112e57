package com.knowledgeengine.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledgeengine.model.entity.NodeEntity;
import com.knowledgeengine.model.entity.RelationEntity;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.NodeType;
import com.knowledgeengine.model.graph.Relation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts between table rows and graph model objects, including the JSON metadata column.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphMapper {

    private final ObjectMapper objectMapper;

    public Node toNode(NodeEntity entity) {
        return Node.builder()
                .uri(entity.getUri())
                .nodeType(NodeType.fromScheme(entity.getNodeType()))
                .name(entity.getName())
                .content(entity.getContent())
                .metadata(readMetadata(entity.getMetadata(), entity.getUri()))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public Relation toRelation(RelationEntity entity) {
        return Relation.builder()
                .sourceUri(entity.getSourceUri())
                .targetUri(entity.getTargetUri())
                .relationType(entity.getRelationType())
                .weight(entity.getWeight() == null ? 1.0 : entity.getWeight())
                .metadata(readMetadata(entity.getMetadata(), entity.getSourceUri()))
                .createdAt(entity.getCreatedAt())
                .build();
    }

    /**
     * Parse a metadata column. Missing or unreadable values become an empty object.
     */
    public ObjectNode readMetadata(String json, String ownerUri) {
        if (json == null || json.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode parsed = objectMapper.readTree(json);
            if (parsed instanceof ObjectNode) {
                return (ObjectNode) parsed;
            }
            log.warn("Metadata of {} is not a JSON object, ignoring it", ownerUri);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata on {}: {}", ownerUri, e.getOriginalMessage());
        }
        return objectMapper.createObjectNode();
    }

    public String writeMetadata(ObjectNode metadata) {
        ObjectNode value = metadata == null ? objectMapper.createObjectNode() : metadata;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Metadata could not be serialized", e);
        }
    }

    public ObjectNode emptyMetadata() {
        return objectMapper.createObjectNode();
    }

    /**
     * Metadata equality treating null as an empty object.
     */
    public boolean sameMetadata(ObjectNode left, ObjectNode right) {
        ObjectNode a = left == null ? emptyMetadata() : left;
        ObjectNode b = right == null ? emptyMetadata() : right;
        return a.equals(b);
    }
}
