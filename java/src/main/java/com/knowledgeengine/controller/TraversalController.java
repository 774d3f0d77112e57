package com.knowledgeengine.controller;

import com.knowledgeengine.model.dto.TraverseRequest;
import com.knowledgeengine.model.graph.Subgraph;
import com.knowledgeengine.model.graph.TraversalResult;
import com.knowledgeengine.service.KnowledgeGraphService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Controller for traversal and subgraph export.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class TraversalController {

    private final KnowledgeGraphService knowledgeGraphService;

    @PostMapping("/traverse")
    public Mono<TraversalResult> traverse(@Valid @RequestBody TraverseRequest request) {
        return knowledgeGraphService.traverse(request);
    }

    /**
     * Served to peer workspaces fetching nodes of this one.
     */
    @GetMapping("/export")
    public Mono<Subgraph> export(@RequestParam String uri,
                                 @RequestParam(required = false) Double maxCost) {
        return knowledgeGraphService.exportSubgraph(uri, maxCost);
    }
}
