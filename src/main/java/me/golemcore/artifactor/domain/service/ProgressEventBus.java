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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-run broadcast log with replay.
 *
 * <p>
 * Each key owns an append-only, ordered log. A subscriber receives every event
 * published so far, then live events, and completes once the channel is
 * completed and its log is drained. Any number of subscribers may attach at
 * any time, including after completion while the channel is retained.
 *
 * <p>
 * Publishing is serialized per channel, so concurrent publishers never reorder
 * or drop events. Completed channels are kept for the retention window and
 * swept lazily when a channel is created, or removed explicitly via
 * {@link #release(String)}.
 *
 * @param <E>
 *            event type
 */
@Slf4j
public class ProgressEventBus<E> {

    private final Map<String, Channel<E>> channels = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;

    public ProgressEventBus(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * Create a fresh channel for the key. An existing channel under the same key
     * is completed and replaced.
     */
    public void createChannel(String key) {
        sweepExpired();
        Channel<E> previous = channels.put(key, new Channel<>());
        if (previous != null) {
            previous.complete(Instant.now(clock));
            log.debug("[Progress] Channel reset: {}", key);
        }
    }

    /**
     * Append an event to the key's log. Ignored when no channel exists or the
     * channel is already completed.
     *
     * @return true if the event was appended
     */
    public boolean publish(String key, E event) {
        Channel<E> channel = channels.get(key);
        if (channel == null) {
            return false;
        }
        return channel.publish(event);
    }

    /**
     * Mark the channel complete. Idempotent; the channel stays available to late
     * subscribers until it expires or is released.
     */
    public void complete(String key) {
        Channel<E> channel = channels.get(key);
        if (channel != null) {
            channel.complete(Instant.now(clock));
        }
    }

    /**
     * Stream the key's events: full replay, then live, then completion. An
     * unknown key yields an empty stream.
     */
    public Flux<E> subscribe(String key) {
        Channel<E> channel = channels.get(key);
        if (channel == null) {
            return Flux.empty();
        }
        return channel.sink.asFlux();
    }

    public boolean hasActiveChannel(String key) {
        Channel<E> channel = channels.get(key);
        return channel != null && !channel.isCompleted();
    }

    /**
     * Check whether a channel exists for the key, active or retained.
     */
    public boolean hasChannel(String key) {
        return channels.containsKey(key);
    }

    /**
     * Snapshot of the events published so far, in publication order.
     */
    public List<E> latestEvents(String key) {
        Channel<E> channel = channels.get(key);
        if (channel == null) {
            return List.of();
        }
        return channel.snapshot();
    }

    /**
     * Discard the key's channel. Open subscriptions are completed.
     */
    public void release(String key) {
        Channel<E> channel = channels.remove(key);
        if (channel != null) {
            channel.complete(Instant.now(clock));
        }
    }

    private void sweepExpired() {
        Instant cutoff = Instant.now(clock).minus(retention);
        channels.entrySet().removeIf(entry -> {
            Instant completedAt = entry.getValue().completedAt();
            return completedAt != null && completedAt.isBefore(cutoff);
        });
    }

    private static final class Channel<E> {

        private final Object lock = new Object();
        private final Sinks.Many<E> sink = Sinks.many().replay().all();
        private final List<E> history = new ArrayList<>();
        private Instant completedAt;

        boolean publish(E event) {
            synchronized (lock) {
                if (completedAt != null) {
                    return false;
                }
                history.add(event);
                Sinks.EmitResult result = sink.tryEmitNext(event);
                if (result.isFailure()) {
                    log.warn("[Progress] Failed to emit event: {}", result);
                }
                return true;
            }
        }

        void complete(Instant now) {
            synchronized (lock) {
                if (completedAt != null) {
                    return;
                }
                completedAt = now;
                sink.tryEmitComplete();
            }
        }

        boolean isCompleted() {
            synchronized (lock) {
                return completedAt != null;
            }
        }

        Instant completedAt() {
            synchronized (lock) {
                return completedAt;
            }
        }

        List<E> snapshot() {
            synchronized (lock) {
                return List.copyOf(history);
            }
        }
    }
}
