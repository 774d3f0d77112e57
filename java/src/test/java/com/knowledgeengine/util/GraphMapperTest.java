package com.knowledgeengine.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledgeengine.model.entity.NodeEntity;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.NodeType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for GraphMapper.
 */
class GraphMapperTest {

    private final GraphMapper graphMapper = new GraphMapper(new ObjectMapper());

    @Test
    void toNode_ParsesTaggedMetadataValues() {
        NodeEntity entity = NodeEntity.builder()
                .uri("concept://local/x")
                .nodeType("concept")
                .name("X")
                .metadata("{\"tags\":[\"a\",\"b\"],\"score\":0.5,\"draft\":true,\"owner\":{\"team\":\"core\"},\"note\":null}")
                .build();

        Node node = graphMapper.toNode(entity);

        assertThat(node.getNodeType()).isEqualTo(NodeType.CONCEPT);
        ObjectNode metadata = node.getMetadata();
        assertThat(metadata.get("tags").isArray()).isTrue();
        assertThat(metadata.get("score").isNumber()).isTrue();
        assertThat(metadata.get("draft").booleanValue()).isTrue();
        assertThat(metadata.get("owner").get("team").asText()).isEqualTo("core");
        assertThat(metadata.get("note").isNull()).isTrue();
    }

    @Test
    void readMetadata_UnreadableOrMissing_BecomesEmptyObject() {
        assertThat(graphMapper.readMetadata(null, "concept://local/x").size()).isZero();
        assertThat(graphMapper.readMetadata("not json", "concept://local/x").size()).isZero();
        assertThat(graphMapper.readMetadata("[1,2]", "concept://local/x").size()).isZero();
    }

    @Test
    void sameMetadata_TreatsNullAsEmpty() {
        assertThat(graphMapper.sameMetadata(null, graphMapper.emptyMetadata())).isTrue();
        ObjectNode tagged = graphMapper.emptyMetadata().put("k", "v");
        assertThat(graphMapper.sameMetadata(tagged, graphMapper.emptyMetadata())).isFalse();
    }
}
