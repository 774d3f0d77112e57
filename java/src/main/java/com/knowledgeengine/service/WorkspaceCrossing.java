package com.knowledgeengine.service;

import com.knowledgeengine.model.graph.GraphWarning;
import lombok.AllArgsConstructor;
import lombok.Data;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Hook invoked when a search steps onto a node of another workspace that is not stored locally.
 */
public interface WorkspaceCrossing {

    /** Never crosses; used for exports and remote-database searches. */
    WorkspaceCrossing NONE = new WorkspaceCrossing() {
        @Override
        public boolean crosses(String fromUri, String toUri) {
            return false;
        }

        @Override
        public Mono<Materialization> materialize(String uri) {
            return Mono.just(Materialization.unavailable(List.of()));
        }
    };

    /**
     * Whether the absent {@code toUri}, reached from {@code fromUri}, lies in a workspace this hook can fetch from.
     */
    boolean crosses(String fromUri, String toUri);

    /**
     * Bring {@code uri} into the local store. Never errors; failures are reported as warnings.
     */
    Mono<Materialization> materialize(String uri);

    @Data
    @AllArgsConstructor
    class Materialization {
        private boolean available;
        private List<GraphWarning> warnings;

        public static Materialization available(List<GraphWarning> warnings) {
            return new Materialization(true, warnings);
        }

        public static Materialization unavailable(List<GraphWarning> warnings) {
            return new Materialization(false, warnings);
        }
    }
}
