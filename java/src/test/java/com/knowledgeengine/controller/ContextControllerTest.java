package com.knowledgeengine.controller;

import com.knowledgeengine.config.SecurityConfig;
import com.knowledgeengine.model.dto.ContextStatus;
import com.knowledgeengine.model.dto.UriRequest;
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

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = ContextController.class)
@Import(SecurityConfig.class)
class ContextControllerTest {

    private static final String A = "concept://local/a";

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private KnowledgeGraphService knowledgeGraphService;

    @Test
    void add_TouchesNode() {
        when(knowledgeGraphService.addToContext(A)).thenReturn(Mono.just(ContextStatus.builder()
                .members(List.of(A))
                .evicted(List.of())
                .size(1)
                .cap(100)
                .build()));

        webTestClient.post()
                .uri("/v1/context")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new UriRequest(A))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.members[0]").isEqualTo(A)
                .jsonPath("$.size").isEqualTo(1);
    }

    @Test
    void delete_WithUri_EvictsOne() {
        when(knowledgeGraphService.evictFromContext(A)).thenReturn(Mono.just(ContextStatus.builder()
                .members(List.of())
                .evicted(List.of(A))
                .build()));

        webTestClient.delete()
                .uri(builder -> builder.path("/v1/context").queryParam("uri", "{uri}").build(A))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.evicted[0]").isEqualTo(A);

        verify(knowledgeGraphService, never()).clearContext();
    }

    @Test
    void delete_WithoutUri_Clears() {
        when(knowledgeGraphService.clearContext()).thenReturn(Mono.just(ContextStatus.builder()
                .members(List.of())
                .evicted(List.of(A, "concept://local/b"))
                .build()));

        webTestClient.delete()
                .uri("/v1/context")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.evicted.length()").isEqualTo(2);
    }
}
