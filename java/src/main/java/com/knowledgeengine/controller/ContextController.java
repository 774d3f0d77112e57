package com.knowledgeengine.controller;

import com.knowledgeengine.model.dto.ContextSnapshot;
import com.knowledgeengine.model.dto.ContextStatus;
import com.knowledgeengine.model.dto.UriRequest;
import com.knowledgeengine.service.KnowledgeGraphService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Controller for the Active Context.
 */
@RestController
@RequestMapping("/v1/context")
@RequiredArgsConstructor
public class ContextController {

    private final KnowledgeGraphService knowledgeGraphService;

    @GetMapping
    public Mono<ContextSnapshot> snapshot() {
        return knowledgeGraphService.getActiveContext();
    }

    @PostMapping
    public Mono<ContextStatus> add(@Valid @RequestBody UriRequest request) {
        return knowledgeGraphService.addToContext(request.getUri());
    }

    @DeleteMapping(params = "uri")
    public Mono<ContextStatus> evict(@RequestParam String uri) {
        return knowledgeGraphService.evictFromContext(uri);
    }

    @DeleteMapping(params = "!uri")
    public Mono<ContextStatus> clear() {
        return knowledgeGraphService.clearContext();
    }
}
