package com.knowledgeengine.controller;

import com.knowledgeengine.model.graph.GraphEvent;
import com.knowledgeengine.service.KnowledgeGraphService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Server-sent stream of graph and context changes.
 */
@Slf4j
@RestController
@RequestMapping("/v1/events")
@RequiredArgsConstructor
public class EventController {

    private final KnowledgeGraphService knowledgeGraphService;

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<GraphEvent>> subscribe() {
        return knowledgeGraphService.subscribe()
                .map(event -> ServerSentEvent.<GraphEvent>builder()
                        .event(event.getType().getWireName())
                        .data(event)
                        .build())
                .doOnSubscribe(subscription -> log.debug("Event subscriber connected"))
                .doOnCancel(() -> log.debug("Event subscriber disconnected"));
    }
}
