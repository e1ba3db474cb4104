package me.golemcore.artifactor.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.domain.model.TraceEvent;
import me.golemcore.artifactor.port.outbound.TraceHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Best-effort fan-out of trace events to registered handlers.
 *
 * <p>
 * Handlers are keyed by name; registering a second handler with a name that is
 * already present is a no-op. Events are delivered to handlers one after
 * another in registration order. A handler that throws or fails its future is
 * logged and skipped, so tracing never fails the caller.
 */
@Slf4j
public class TraceDispatcher {

    private final Object lock = new Object();
    private final List<TraceHandler> handlers = new ArrayList<>();

    /**
     * Register a handler.
     *
     * @return true if the handler was added, false if one with the same name is
     *         already registered
     */
    public boolean register(TraceHandler handler) {
        synchronized (lock) {
            for (TraceHandler existing : handlers) {
                if (existing.getName().equals(handler.getName())) {
                    return false;
                }
            }
            handlers.add(handler);
        }
        log.debug("[Trace] Registered handler: {}", handler.getName());
        return true;
    }

    public int handlerCount() {
        synchronized (lock) {
            return handlers.size();
        }
    }

    /**
     * Deliver an event to every handler. The returned future completes once
     * every handler has been tried and never completes exceptionally.
     */
    public CompletableFuture<Void> emit(TraceEvent event) {
        List<TraceHandler> snapshot;
        synchronized (lock) {
            if (handlers.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            snapshot = List.copyOf(handlers);
        }

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (TraceHandler handler : snapshot) {
            chain = chain.thenCompose(ignored -> deliver(handler, event));
        }
        return chain;
    }

    private CompletableFuture<Void> deliver(TraceHandler handler, TraceEvent event) {
        CompletableFuture<Void> future;
        try {
            future = handler.handle(event);
        } catch (RuntimeException e) {
            logHandlerError(handler, event, e);
            return CompletableFuture.completedFuture(null);
        }
        if (future == null) {
            return CompletableFuture.completedFuture(null);
        }
        return future.handle((ignored, error) -> {
            if (error != null) {
                logHandlerError(handler, event, error);
            }
            return null;
        });
    }

    private void logHandlerError(TraceHandler handler, TraceEvent event, Throwable error) {
        log.warn("[Trace] Handler {} failed on {} event: {}", handler.getName(), event.type().wireValue(),
                error.getMessage());
    }
}
