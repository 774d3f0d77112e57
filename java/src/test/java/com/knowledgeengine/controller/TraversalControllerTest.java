package com.knowledgeengine.controller;

import com.knowledgeengine.config.SecurityConfig;
import com.knowledgeengine.exception.NotFoundException;
import com.knowledgeengine.model.dto.TraverseRequest;
import com.knowledgeengine.model.graph.GraphWarning;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.NodeType;
import com.knowledgeengine.model.graph.Subgraph;
import com.knowledgeengine.model.graph.TraversalResult;
import com.knowledgeengine.model.graph.TraversedNode;
import com.knowledgeengine.service.KnowledgeGraphService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = TraversalController.class)
@Import(SecurityConfig.class)
class TraversalControllerTest {

    private static final String SEED = "concept://local/seed";

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private KnowledgeGraphService knowledgeGraphService;

    @Test
    void traverse_ReturnsAcceptedNodesAndWarnings() {
        Node seed = Node.builder().uri(SEED).nodeType(NodeType.CONCEPT).build();
        TraversalResult result = TraversalResult.builder()
                .seedUri(SEED)
                .maxCost(0.5)
                .nodes(List.of(new TraversedNode(seed, 0.0)))
                .warnings(List.of(GraphWarning.danglingConcept("concept://local/gone")))
                .build();
        when(knowledgeGraphService.traverse(any(TraverseRequest.class))).thenReturn(Mono.just(result));

        webTestClient.post()
                .uri("/v1/traverse")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(TraverseRequest.builder().seedUri(SEED).maxCost(0.5).build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.nodes[0].node.uri").isEqualTo(SEED)
                .jsonPath("$.nodes[0].cost").isEqualTo(0.0)
                .jsonPath("$.warnings[0].uri").isEqualTo("concept://local/gone");
    }

    @Test
    void traverse_NegativeBudget_BadRequest() {
        webTestClient.post()
                .uri("/v1/traverse")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(TraverseRequest.builder().seedUri(SEED).maxCost(-1.0).build())
                .exchange()
                .expectStatus().isBadRequest();

        verify(knowledgeGraphService, never()).traverse(any());
    }

    @Test
    void traverse_UnknownSeed_NotFound() {
        when(knowledgeGraphService.traverse(any(TraverseRequest.class)))
                .thenReturn(Mono.error(new NotFoundException("Node", SEED)));

        webTestClient.post()
                .uri("/v1/traverse")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(TraverseRequest.builder().seedUri(SEED).build())
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void export_DefaultsBudget() {
        when(knowledgeGraphService.exportSubgraph(eq(SEED), isNull()))
                .thenReturn(Mono.just(Subgraph.builder().seedUri(SEED).build()));

        webTestClient.get()
                .uri(builder -> builder.path("/v1/export").queryParam("uri", "{uri}").build(SEED))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.seedUri").isEqualTo(SEED)
                .jsonPath("$.nodes").isEmpty();
    }
}
