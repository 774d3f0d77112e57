package com.knowledgeengine.service;

import com.knowledgeengine.config.KnowledgeProperties;
import com.knowledgeengine.model.dto.ContextSnapshot;
import com.knowledgeengine.model.graph.Node;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Bounded, least-recently-used view over the graph.
 *
 * Holds URIs only; node data is read from the store when a snapshot is taken.
 * Every operation takes the same lock.
 */
@Slf4j
@Component
public class ActiveContext {

    private final Object lock = new Object();
    private final GraphStore graphStore;
    private final int cap;

    /** Access-ordered: iteration runs from least to most recently used. */
    private final LinkedHashMap<String, Long> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long clock;

    public ActiveContext(GraphStore graphStore, KnowledgeProperties properties) {
        this.graphStore = graphStore;
        this.cap = properties.getContext().getCap();
        if (cap <= 0) {
            throw new IllegalArgumentException("knowledge.context.cap must be positive, got " + cap);
        }
    }

    /**
     * Mark a URI most recently used, inserting it if absent.
     *
     * @return URIs evicted to stay within the cap
     */
    public List<String> touch(String uri) {
        synchronized (lock) {
            entries.put(uri, ++clock);
            return evictOverflow();
        }
    }

    /**
     * Touch URIs in order, so the last one ends up most recently used.
     */
    public List<String> touchAll(List<String> uris) {
        synchronized (lock) {
            for (String uri : uris) {
                entries.put(uri, ++clock);
            }
            return evictOverflow();
        }
    }

    public boolean evict(String uri) {
        synchronized (lock) {
            return entries.remove(uri) != null;
        }
    }

    /**
     * Replace a member's URI keeping its recency position.
     */
    public boolean rename(String oldUri, String newUri) {
        synchronized (lock) {
            if (!entries.containsKey(oldUri)) {
                return false;
            }
            List<Map.Entry<String, Long>> ordered = new ArrayList<>(entries.entrySet());
            entries.clear();
            for (Map.Entry<String, Long> entry : ordered) {
                String key = entry.getKey().equals(oldUri) ? newUri : entry.getKey();
                entries.put(key, entry.getValue());
            }
            return true;
        }
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
        }
    }

    public boolean contains(String uri) {
        synchronized (lock) {
            return entries.containsKey(uri);
        }
    }

    /**
     * @return members, most recently used first
     */
    public List<String> members() {
        synchronized (lock) {
            List<String> members = new ArrayList<>(entries.keySet());
            Collections.reverse(members);
            return members;
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int getCap() {
        return cap;
    }

    /**
     * Members with their nodes and only the edges between members.
     */
    public Mono<ContextSnapshot> snapshot() {
        List<String> members = members();
        return graphStore.getNodes(members)
                .collectMap(Node::getUri, Function.identity())
                .zipWith(graphStore.getRelationsAmong(members).collectList())
                .map(tuple -> {
                    Map<String, Node> nodes = tuple.getT1();
                    return ContextSnapshot.builder()
                            .members(members)
                            .nodes(members.stream()
                                    .filter(nodes::containsKey)
                                    .map(nodes::get)
                                    .collect(Collectors.toList()))
                            .relations(tuple.getT2())
                            .cap(cap)
                            .build();
                });
    }

    private List<String> evictOverflow() {
        List<String> evicted = new ArrayList<>();
        Iterator<String> eldest = entries.keySet().iterator();
        while (entries.size() > cap && eldest.hasNext()) {
            evicted.add(eldest.next());
            eldest.remove();
        }
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} from active context", evicted);
        }
        return evicted;
    }
}
