package com.knowledgeengine.controller;

import com.knowledgeengine.model.dto.AddConceptResponse;
import com.knowledgeengine.model.dto.ConceptCreateRequest;
import com.knowledgeengine.model.dto.ConceptUpdateRequest;
import com.knowledgeengine.model.dto.LinkRequest;
import com.knowledgeengine.model.dto.MoveRequest;
import com.knowledgeengine.model.dto.NodeDetailsResponse;
import com.knowledgeengine.model.dto.RelationsResponse;
import com.knowledgeengine.model.dto.ResourceCreateRequest;
import com.knowledgeengine.model.graph.LinkOutcome;
import com.knowledgeengine.model.graph.Node;
import com.knowledgeengine.service.KnowledgeGraphService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Controller for node and relation editing.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class GraphController {

    private final KnowledgeGraphService knowledgeGraphService;

    @PostMapping("/concepts")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<AddConceptResponse> addConcept(@Valid @RequestBody ConceptCreateRequest request) {
        return knowledgeGraphService.addConcept(request);
    }

    @PutMapping("/concepts")
    public Mono<Node> updateConcept(@Valid @RequestBody ConceptUpdateRequest request) {
        return knowledgeGraphService.updateConcept(request);
    }

    @PostMapping("/concepts/move")
    public Mono<Node> moveConcept(@Valid @RequestBody MoveRequest request) {
        return knowledgeGraphService.moveConcept(request);
    }

    @PostMapping("/resources")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Node> addResource(@Valid @RequestBody ResourceCreateRequest request) {
        return knowledgeGraphService.addResource(request);
    }

    @GetMapping("/nodes")
    public Mono<NodeDetailsResponse> getNode(@RequestParam String uri) {
        return knowledgeGraphService.getNode(uri);
    }

    @DeleteMapping("/nodes")
    public Mono<Map<String, Boolean>> deleteNode(@RequestParam String uri) {
        return knowledgeGraphService.deleteNode(uri)
                .map(deleted -> Map.of("deleted", deleted));
    }

    @PostMapping("/relations")
    public Mono<LinkOutcome> link(@Valid @RequestBody LinkRequest request) {
        return knowledgeGraphService.link(request);
    }

    @GetMapping("/relations")
    public Mono<RelationsResponse> getRelations(@RequestParam String uri) {
        return knowledgeGraphService.getRelations(uri);
    }

    @DeleteMapping("/relations")
    public Mono<Map<String, Boolean>> unlink(@RequestParam String sourceUri,
                                             @RequestParam String targetUri,
                                             @RequestParam String relationType) {
        return knowledgeGraphService.unlink(sourceUri, targetUri, relationType)
                .map(deleted -> Map.of("deleted", deleted));
    }
}
