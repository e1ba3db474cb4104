package me.golemcore.artifactor.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IdempotencyGuardTest {

    private IdempotencyGuard guard;

    @BeforeEach
    void setUp() {
        guard = new IdempotencyGuard();
    }

    @Test
    void shouldShareSingleExecutionBetweenConcurrentCallers() throws Exception {
        AtomicInteger starts = new AtomicInteger();
        CompletableFuture<String> operation = new CompletableFuture<>();

        CompletableFuture<String> first = guard.execute("p1", () -> {
            starts.incrementAndGet();
            return operation;
        });
        CompletableFuture<String> second = guard.execute("p1", () -> {
            starts.incrementAndGet();
            return CompletableFuture.completedFuture("other");
        });

        assertEquals(1, starts.get());
        assertTrue(guard.activeKeys().contains("p1"));

        operation.complete("done");

        assertEquals("done", first.get(1, TimeUnit.SECONDS));
        assertEquals("done", second.get(1, TimeUnit.SECONDS));
        assertTrue(guard.activeKeys().isEmpty());
    }

    @Test
    void shouldDeliverSameErrorToEveryCaller() {
        CompletableFuture<String> operation = new CompletableFuture<>();
        CompletableFuture<String> first = guard.execute("p1", () -> operation);
        CompletableFuture<String> second = guard.execute("p1", () -> operation);

        IllegalStateException failure = new IllegalStateException("boom");
        operation.completeExceptionally(failure);

        ExecutionException firstError = assertThrows(ExecutionException.class,
                () -> first.get(1, TimeUnit.SECONDS));
        ExecutionException secondError = assertThrows(ExecutionException.class,
                () -> second.get(1, TimeUnit.SECONDS));
        assertSame(failure, firstError.getCause());
        assertSame(failure, secondError.getCause());
    }

    @Test
    void shouldStartFreshOperationAfterCompletion() throws Exception {
        AtomicInteger starts = new AtomicInteger();

        String first = guard.execute("p1", () -> CompletableFuture.completedFuture("run-" + starts.incrementAndGet()))
                .get(1, TimeUnit.SECONDS);
        String second = guard.execute("p1", () -> CompletableFuture.completedFuture("run-" + starts.incrementAndGet()))
                .get(1, TimeUnit.SECONDS);

        assertEquals("run-1", first);
        assertEquals("run-2", second);
    }

    @Test
    void shouldNotBlockDistinctKeys() throws Exception {
        CompletableFuture<String> slow = new CompletableFuture<>();
        guard.execute("a", () -> slow);

        String other = guard.execute("b", () -> CompletableFuture.completedFuture("b-done"))
                .get(1, TimeUnit.SECONDS);

        assertEquals("b-done", other);
        assertFalse(slow.isDone());
        slow.complete("a-done");
    }

    @Test
    void shouldCaptureSupplierException() {
        CompletableFuture<String> result = guard.execute("p1", () -> {
            throw new IllegalArgumentException("bad input");
        });

        ExecutionException error = assertThrows(ExecutionException.class, () -> result.get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
        assertTrue(guard.activeKeys().isEmpty());
    }

    @Test
    void shouldPropagateOwnerCancellationToWaiters() {
        CompletableFuture<String> operation = new CompletableFuture<>();
        CompletableFuture<String> owner = guard.execute("p1", () -> operation);
        CompletableFuture<String> waiter = guard.execute("p1", () -> operation);

        owner.cancel(true);

        assertTrue(operation.isCancelled());
        assertThrows(CancellationException.class, () -> waiter.get(1, TimeUnit.SECONDS));
        assertTrue(guard.activeKeys().isEmpty());
    }

    @Test
    void shouldDetachOnlyCancelledWaiter() throws Exception {
        CompletableFuture<String> operation = new CompletableFuture<>();
        CompletableFuture<String> owner = guard.execute("p1", () -> operation);
        CompletableFuture<String> waiter = guard.execute("p1", () -> operation);

        waiter.cancel(true);
        operation.complete("done");

        assertFalse(operation.isCancelled());
        assertEquals("done", owner.get(1, TimeUnit.SECONDS));
    }

    @Test
    void shouldFailWhenSupplierReturnsNull() {
        CompletableFuture<String> result = guard.execute("p1", () -> null);

        ExecutionException error = assertThrows(ExecutionException.class, () -> result.get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }
}
