package com.marketlevels.marketdata.cache;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * One in-flight upstream fetch. Every caller asking for the same key while it is
 * pending subscribes to {@link #result()}; subscribers are signalled in the order
 * they attached.
 */
final class PendingRequest<T> {

    private final String       key;
    private final Sinks.One<T> sink = Sinks.one();

    PendingRequest(String key) {
        this.key = key;
    }

    String key() {
        return key;
    }

    Mono<T> result() {
        return sink.asMono();
    }

    void succeed(T value) {
        sink.tryEmitValue(value);
    }

    void fail(Throwable error) {
        sink.tryEmitError(error);
    }

    void completeEmpty() {
        sink.tryEmitEmpty();
    }
}
