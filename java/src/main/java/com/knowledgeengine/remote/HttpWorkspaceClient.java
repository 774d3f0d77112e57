package com.knowledgeengine.remote;

import com.knowledgeengine.model.graph.Subgraph;
import com.knowledgeengine.model.graph.WorkspaceEntry;
import com.knowledgeengine.model.graph.WorkspaceStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Reads exports from another knowledge engine over HTTP.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpWorkspaceClient implements WorkspaceClient {

    private final WebClient.Builder webClientBuilder;

    @Override
    public WorkspaceStrategy strategy() {
        return WorkspaceStrategy.NETWORK;
    }

    @Override
    public Mono<Subgraph> fetchSubgraph(WorkspaceEntry workspace, String uri) {
        WebClient webClient = webClientBuilder.clone().baseUrl(workspace.getEndpoint()).build();

        return webClient.get()
                .uri(builder -> builder.path("/v1/export").queryParam("uri", "{uri}").build(uri))
                .accept(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    if (workspace.getApiKey() != null && !workspace.getApiKey().isBlank()) {
                        headers.setBearerAuth(workspace.getApiKey());
                    }
                })
                .exchangeToMono(response -> {
                    if (response.statusCode().equals(HttpStatus.NOT_FOUND)) {
                        log.debug("Workspace {} does not know {}", workspace.getId(), uri);
                        return response.releaseBody().thenReturn(Subgraph.builder().seedUri(uri).build());
                    }
                    return response.statusCode().is2xxSuccessful()
                            ? response.bodyToMono(Subgraph.class)
                            : response.createException().flatMap(Mono::error);
                });
    }
}
