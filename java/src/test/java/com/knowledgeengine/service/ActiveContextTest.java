package com.knowledgeengine.service;

import com.knowledgeengine.config.KnowledgeProperties;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.model.graph.NodeType;
import com.knowledgeengine.model.graph.Relation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ActiveContext.
 */
@ExtendWith(MockitoExtension.class)
class ActiveContextTest {

    @Mock
    private GraphStore graphStore;

    private ActiveContext activeContext;

    @BeforeEach
    void setUp() {
        KnowledgeProperties properties = new KnowledgeProperties();
        properties.getContext().setCap(2);
        activeContext = new ActiveContext(graphStore, properties);
    }

    @Test
    void touch_BeyondCap_EvictsLeastRecentlyUsed() {
        activeContext.touch("concept://local/x");
        activeContext.touch("concept://local/y");
        List<String> evicted = activeContext.touch("concept://local/z");

        assertThat(evicted).containsExactly("concept://local/x");
        assertThat(activeContext.members()).containsExactly("concept://local/z", "concept://local/y");
        assertThat(activeContext.contains("concept://local/x")).isFalse();
    }

    @Test
    void touch_ExistingMember_RefreshesRecency() {
        activeContext.touch("concept://local/x");
        activeContext.touch("concept://local/y");
        activeContext.touch("concept://local/x");
        List<String> evicted = activeContext.touch("concept://local/z");

        assertThat(evicted).containsExactly("concept://local/y");
        assertThat(activeContext.members()).containsExactly("concept://local/z", "concept://local/x");
    }

    @Test
    void touchAll_LastUriBecomesMostRecent() {
        List<String> evicted = activeContext.touchAll(List.of("concept://local/a", "concept://local/b", "concept://local/c"));

        assertThat(evicted).containsExactly("concept://local/a");
        assertThat(activeContext.members()).containsExactly("concept://local/c", "concept://local/b");
    }

    @Test
    void rename_KeepsRecencyPosition() {
        activeContext.touch("concept://local/x");
        activeContext.touch("concept://local/y");

        assertThat(activeContext.rename("concept://local/x", "concept://local/x2")).isTrue();

        assertThat(activeContext.members()).containsExactly("concept://local/y", "concept://local/x2");
        assertThat(activeContext.rename("concept://local/missing", "concept://local/other")).isFalse();
    }

    @Test
    void evictAndClear_RemoveMembers() {
        activeContext.touch("concept://local/x");
        activeContext.touch("concept://local/y");

        assertThat(activeContext.evict("concept://local/x")).isTrue();
        assertThat(activeContext.evict("concept://local/x")).isFalse();
        assertThat(activeContext.size()).isEqualTo(1);

        activeContext.clear();
        assertThat(activeContext.members()).isEmpty();
    }

    @Test
    void snapshot_ContainsMemberNodesAndEdgesAmongMembers() {
        Node x = Node.builder().uri("concept://local/x").nodeType(NodeType.CONCEPT).build();
        Node y = Node.builder().uri("concept://local/y").nodeType(NodeType.CONCEPT).build();
        Relation xy = Relation.builder().sourceUri(x.getUri()).targetUri(y.getUri()).relationType("related").build();
        activeContext.touch(x.getUri());
        activeContext.touch(y.getUri());

        when(graphStore.getNodes(anyCollection())).thenReturn(Flux.just(x, y));
        when(graphStore.getRelationsAmong(anyCollection())).thenReturn(Flux.just(xy));

        StepVerifier.create(activeContext.snapshot())
                .assertNext(snapshot -> {
                    assertThat(snapshot.getMembers()).containsExactly(y.getUri(), x.getUri());
                    assertThat(snapshot.getNodes()).containsExactly(y, x);
                    assertThat(snapshot.getRelations()).containsExactly(xy);
                    assertThat(snapshot.getCap()).isEqualTo(2);
                })
                .verifyComplete();
    }
}
