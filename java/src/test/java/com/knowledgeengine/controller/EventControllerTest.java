package com.knowledgeengine.controller;

import com.knowledgeengine.config.SecurityConfig;
import com.knowledgeengine.model.graph.GraphEvent;
import com.knowledgeengine.service.KnowledgeGraphService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = EventController.class)
@Import(SecurityConfig.class)
class EventControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private KnowledgeGraphService knowledgeGraphService;

    @Test
    void subscribe_StreamsEventsNamedByType() {
        when(knowledgeGraphService.subscribe())
                .thenReturn(Flux.just(GraphEvent.nodeRemoved("concept://local/a")));

        Flux<ServerSentEvent<String>> body = webTestClient.get()
                .uri("/v1/events")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(new ParameterizedTypeReference<ServerSentEvent<String>>() { })
                .getResponseBody();

        StepVerifier.create(body)
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo("node_removed");
                    assertThat(event.data()).contains("concept://local/a");
                })
                .verifyComplete();
    }
}
