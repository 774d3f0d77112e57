package com.knowledgeengine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeengine.config.KnowledgeProperties;
import com.knowledgeengine.model.entity.NodeEntity;
import com.knowledgeengine.model.graph.NodeType;
import com.knowledgeengine.model.graph.WarningKind;
import com.knowledgeengine.model.graph.WorkspaceStrategy;
import com.knowledgeengine.repository.NodeRepository;
import com.knowledgeengine.util.GraphMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for LinkResolver.
 */
@ExtendWith(MockitoExtension.class)
class LinkResolverTest {

    private static final String SOURCE = "concept://local/a";

    @Mock
    private NodeRepository nodeRepository;

    private LinkResolver linkResolver;

    @BeforeEach
    void setUp() {
        KnowledgeProperties properties = new KnowledgeProperties();
        KnowledgeProperties.Workspace team = new KnowledgeProperties.Workspace();
        team.setStrategy(WorkspaceStrategy.NETWORK);
        team.setEndpoint("http://team.example:8080");
        properties.getWorkspaces().put("team", team);
        linkResolver = new LinkResolver(nodeRepository, new WorkspaceRegistry(properties), new GraphMapper(new ObjectMapper()));
    }

    @Test
    void resolve_ExistingEndpoint_NoWarning() {
        when(nodeRepository.existsByUri("concept://local/b")).thenReturn(Mono.just(true));

        StepVerifier.create(linkResolver.resolve(SOURCE, "concept://local/b"))
                .assertNext(resolution -> {
                    assertThat(resolution.getWarning()).isNull();
                    assertThat(resolution.getCreated()).isNull();
                })
                .verifyComplete();
    }

    @Test
    void resolve_MissingResource_AutoCreates() {
        String uri = "resource://local/docs/readme.md";
        when(nodeRepository.existsByUri(uri)).thenReturn(Mono.just(false));
        when(nodeRepository.save(any(NodeEntity.class))).thenAnswer(invocation -> {
            NodeEntity entity = invocation.getArgument(0);
            entity.setId(7L);
            return Mono.just(entity);
        });

        StepVerifier.create(linkResolver.resolve(SOURCE, uri))
                .assertNext(resolution -> {
                    assertThat(resolution.getWarning()).isNull();
                    assertThat(resolution.getCreated().getUri()).isEqualTo(uri);
                    assertThat(resolution.getCreated().getNodeType()).isEqualTo(NodeType.RESOURCE);
                })
                .verifyComplete();

        ArgumentCaptor<NodeEntity> saved = ArgumentCaptor.forClass(NodeEntity.class);
        verify(nodeRepository).save(saved.capture());
        assertThat(saved.getValue().getName()).isNull();
        assertThat(saved.getValue().getContent()).isNull();
        assertThat(saved.getValue().getMetadata()).isEqualTo("{}");
    }

    @Test
    void resolve_MissingConcept_DanglingWarning() {
        String uri = "concept://local/later";
        when(nodeRepository.existsByUri(uri)).thenReturn(Mono.just(false));

        StepVerifier.create(linkResolver.resolve(SOURCE, uri))
                .assertNext(resolution -> {
                    assertThat(resolution.getWarning().getKind()).isEqualTo(WarningKind.DANGLING_CONCEPT);
                    assertThat(resolution.getWarning().getUri()).isEqualTo(uri);
                })
                .verifyComplete();

        verify(nodeRepository, never()).save(any(NodeEntity.class));
    }

    @Test
    void resolve_MissingRemoteResource_NotFabricated() {
        String uri = "resource://team/spec.pdf";
        when(nodeRepository.existsByUri(uri)).thenReturn(Mono.just(false));

        StepVerifier.create(linkResolver.resolve(SOURCE, uri))
                .assertNext(resolution -> {
                    assertThat(resolution.getWarning().getKind()).isEqualTo(WarningKind.DANGLING_REFERENCE);
                    assertThat(resolution.getCreated()).isNull();
                })
                .verifyComplete();

        verify(nodeRepository, never()).save(any(NodeEntity.class));
    }

    @Test
    void needsRemoteFetch_OnlyForAbsentNodesOfOtherRemoteWorkspaces() {
        when(nodeRepository.existsByUri("concept://team/x")).thenReturn(Mono.just(false));

        StepVerifier.create(linkResolver.needsRemoteFetch(SOURCE, "concept://team/x"))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(linkResolver.needsRemoteFetch(SOURCE, "concept://local/b"))
                .expectNext(false)
                .verifyComplete();
        StepVerifier.create(linkResolver.needsRemoteFetch("concept://team/y", "concept://team/x"))
                .expectNext(false)
                .verifyComplete();
    }
}
