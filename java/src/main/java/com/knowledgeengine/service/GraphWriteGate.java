package com.knowledgeengine.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * Runs graph mutations one at a time, each in its own transaction.
 *
 * Waiting writers queue without holding a thread. The turn is taken before the
 * transaction opens and handed to the next writer after it ends, or as soon as
 * a waiting writer is cancelled. Bodies must not call {@link #write} again.
 */
@Component
@RequiredArgsConstructor
public class GraphWriteGate {

    private final TransactionalOperator transactionalOperator;

    private final Object lock = new Object();
    private final Deque<Turn> waiting = new ArrayDeque<>();
    private boolean busy;

    public <T> Mono<T> write(Supplier<Mono<T>> body) {
        return Mono.usingWhen(
                acquire(),
                turn -> transactionalOperator.transactional(Mono.defer(body)),
                turn -> Mono.fromRunnable(() -> release(turn)));
    }

    private Mono<Turn> acquire() {
        return Mono.defer(() -> {
            Turn turn = new Turn();
            synchronized (lock) {
                if (!busy) {
                    busy = true;
                    turn.granted = true;
                    return Mono.just(turn);
                }
                waiting.addLast(turn);
            }
            return turn.signal.asMono()
                    .thenReturn(turn)
                    .doOnNext(granted -> granted.delivered = true)
                    .doOnCancel(() -> {
                        if (!turn.delivered) {
                            release(turn);
                        }
                    });
        });
    }

    /**
     * Give up a turn. Safe to call more than once; a turn still queued is just dropped.
     */
    private void release(Turn turn) {
        Turn next;
        synchronized (lock) {
            if (!turn.granted) {
                waiting.remove(turn);
                return;
            }
            if (turn.released) {
                return;
            }
            turn.released = true;
            next = waiting.pollFirst();
            if (next == null) {
                busy = false;
                return;
            }
            next.granted = true;
        }
        next.signal.tryEmitEmpty();
    }

    int availablePermits() {
        synchronized (lock) {
            return busy ? 0 : 1;
        }
    }

    int queueLength() {
        synchronized (lock) {
            return waiting.size();
        }
    }

    private static final class Turn {
        private final Sinks.Empty<Void> signal = Sinks.empty();
        private boolean granted;
        private boolean released;
        private volatile boolean delivered;
    }
}
