package com.knowledgeengine.controller;

import com.knowledgeengine.model.dto.ConflictResolveRequest;
import com.knowledgeengine.model.dto.StatsResponse;
import com.knowledgeengine.model.dto.UriRequest;
import com.knowledgeengine.model.graph.ConflictReport;
import com.knowledgeengine.model.graph.ImportOutcome;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.service.KnowledgeGraphService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Controller for remote fetches, conflict resolution and statistics.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class RemoteController {

    private final KnowledgeGraphService knowledgeGraphService;

    @PostMapping("/remote/fetch")
    public Mono<ImportOutcome> fetch(@Valid @RequestBody UriRequest request) {
        return knowledgeGraphService.fetchRemoteSubgraph(request.getUri());
    }

    @GetMapping("/conflicts")
    public Flux<ConflictReport> conflicts() {
        return knowledgeGraphService.listConflicts();
    }

    @PostMapping("/conflicts")
    public Mono<Node> resolve(@Valid @RequestBody ConflictResolveRequest request) {
        return knowledgeGraphService.resolveConflict(request);
    }

    @GetMapping("/stats")
    public Mono<StatsResponse> stats() {
        return knowledgeGraphService.stats();
    }
}
