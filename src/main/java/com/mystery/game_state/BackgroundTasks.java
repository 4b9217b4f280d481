package com.mystery.game_state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background work of one game session: detached units plus one serial lane per character.
 * Everything submitted to a character's lane runs after the previous unit of that lane has finished.
 * A failing unit is logged and the lane moves on.
 */
public class BackgroundTasks implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BackgroundTasks.class);

    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final Map<String, CompletableFuture<Void>> lanes = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public BackgroundTasks(Executor executor) {
        this(executor, null);
    }

    private BackgroundTasks(Executor executor, ExecutorService ownedExecutor) {
        this.executor = executor;
        this.ownedExecutor = ownedExecutor;
    }

    public static BackgroundTasks withThreads(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "mystery-bg-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, threads), factory);
        return new BackgroundTasks(pool, pool);
    }

    /**
     * Detached unit with no ordering guarantee
     *
     * @throws IllegalStateException once the session is closed
     */
    public CompletableFuture<Void> submit(String label, Runnable task) {
        ensureOpen();
        return CompletableFuture.runAsync(guarded(label, task), this::execute);
    }

    /**
     * Unit serialized with every other unit on the same character's lane.
     * Still accepted after {@link #close()}: in-flight work applies its results.
     */
    public CompletableFuture<Void> onLane(String character, String label, Runnable task) {
        Runnable guardedTask = guarded(character + ": " + label, task);
        CompletableFuture<Void> next = new CompletableFuture<>();
        CompletableFuture<Void> previous = lanes.put(character, next);
        CompletableFuture<Void> tail = previous != null ? previous : CompletableFuture.completedFuture(null);
        tail.whenComplete((ignored, error) -> execute(() -> {
            guardedTask.run();
            next.complete(null);
        }));
        return next;
    }

    /**
     * Completes when every lane has drained what was queued so far
     */
    public CompletableFuture<Void> idle() {
        return CompletableFuture.allOf(lanes.values().toArray(new CompletableFuture[0]));
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops accepting work. Units already queued still run and their results are applied.
     */
    @Override
    public void close() {
        closed = true;
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    private void execute(Runnable runnable) {
        try {
            executor.execute(runnable);
        } catch (RejectedExecutionException e) {
            // pool already shut down: finish the chained unit on the completing thread
            logger.debug("[BackgroundTasks] Executor rejected a queued unit, running it inline");
            runnable.run();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Game session is closed");
        }
    }

    private static Runnable guarded(String label, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.warn("⚠️ [BackgroundTasks] {} failed: {}", label, e.getMessage(), e);
            }
        };
    }
}
