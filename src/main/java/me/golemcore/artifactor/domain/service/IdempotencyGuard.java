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
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Runs at most one operation per key at a time.
 *
 * <p>
 * The first caller for a key becomes the owner and starts the operation; callers
 * arriving while it is in flight wait for it and observe the identical value or
 * the identical error. Once an operation finishes, the next caller starts a
 * fresh one. Distinct keys never block each other.
 *
 * <p>
 * Completion happens in two steps: the outcome is signalled to waiters first,
 * and the key is removed afterwards in a separate critical section. A caller
 * that arrives between the two steps joins the finished operation and receives
 * its outcome without re-running it.
 *
 * <p>
 * Cancelling the owner's future cancels the operation, and the resulting
 * cancellation is delivered to every waiter. A waiter cancelling its own future
 * only detaches that waiter.
 */
@Service
@Slf4j
public class IdempotencyGuard {

    private final Object lock = new Object();
    private final Map<String, InFlightOperation> inFlight = new HashMap<>();

    public <T> CompletableFuture<T> execute(String key, Supplier<CompletableFuture<T>> operation) {
        InFlightOperation existing;
        InFlightOperation tracker = null;
        synchronized (lock) {
            existing = inFlight.get(key);
            if (existing == null) {
                tracker = new InFlightOperation(key);
                inFlight.put(key, tracker);
            }
        }

        if (existing != null) {
            log.debug("[Guard] Joining in-flight operation: {}", key);
            return existing.await();
        }
        return runAsOwner(tracker, operation);
    }

    /**
     * Snapshot of the keys with an operation in flight.
     */
    public Set<String> activeKeys() {
        synchronized (lock) {
            return Set.copyOf(inFlight.keySet());
        }
    }

    private <T> CompletableFuture<T> runAsOwner(InFlightOperation tracker,
            Supplier<CompletableFuture<T>> operation) {
        CompletableFuture<T> operationFuture;
        try {
            operationFuture = operation.get();
            if (operationFuture == null) {
                operationFuture = CompletableFuture.failedFuture(
                        new IllegalStateException("Operation returned no future: " + tracker.key));
            }
        } catch (RuntimeException e) {
            operationFuture = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> ownerView = new CompletableFuture<>();
        CompletableFuture<T> started = operationFuture;
        ownerView.whenComplete((value, error) -> {
            if (ownerView.isCancelled() && !started.isDone()) {
                log.debug("[Guard] Owner cancelled operation: {}", tracker.key);
                started.cancel(true);
            }
        });

        started.whenComplete((value, error) -> {
            OperationOutcome outcome = error == null
                    ? OperationOutcome.success(value)
                    : OperationOutcome.failure(unwrap(error));
            tracker.signal(outcome);
            release(tracker);
            outcome.deliverTo(ownerView);
        });
        return ownerView;
    }

    private void release(InFlightOperation tracker) {
        synchronized (lock) {
            inFlight.remove(tracker.key, tracker);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Tracker of one in-flight operation. The signal completes exactly once with
     * the captured outcome.
     */
    static final class InFlightOperation {

        private final String key;
        private final CompletableFuture<OperationOutcome> signal = new CompletableFuture<>();

        InFlightOperation(String key) {
            this.key = key;
        }

        void signal(OperationOutcome outcome) {
            signal.complete(outcome);
        }

        <T> CompletableFuture<T> await() {
            CompletableFuture<T> view = new CompletableFuture<>();
            signal.thenAccept(outcome -> outcome.deliverTo(view));
            return view;
        }
    }
}
