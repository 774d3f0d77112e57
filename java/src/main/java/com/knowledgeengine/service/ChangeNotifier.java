package com.knowledgeengine.service;

import com.knowledgeengine.config.KnowledgeProperties;
import com.knowledgeengine.model.graph.GraphEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Fans committed graph changes out to observers.
 *
 * Publishing never blocks and never fails the caller. Every subscriber owns a
 * bounded buffer that drops its oldest events when the subscriber falls behind.
 */
@Slf4j
@Component
public class ChangeNotifier {

    private final Sinks.Many<GraphEvent> sink = Sinks.many().multicast().directBestEffort();
    private final int bufferSize;

    public ChangeNotifier(KnowledgeProperties properties) {
        this.bufferSize = Math.max(1, properties.getEvents().getBufferSize());
    }

    public synchronized void publish(GraphEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Event {} for {} not delivered: {}", event.getType(), event.getUri(), result);
        }
    }

    public Flux<GraphEvent> subscribe() {
        return sink.asFlux()
                .onBackpressureBuffer(bufferSize,
                        dropped -> log.warn("Slow subscriber, dropped {} event for {}", dropped.getType(), dropped.getUri()),
                        BufferOverflowStrategy.DROP_OLDEST);
    }

    public int subscriberCount() {
        return sink.currentSubscriberCount();
    }
}
