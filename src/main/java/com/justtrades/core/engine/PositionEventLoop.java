package com.justtrades.core.engine;

import com.justtrades.domain.model.PositionKey;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Keyed serial executor: one FIFO queue per (account, symbol), drained on a
 * shared pool.
 *
 * <p>Tasks for the same key run one at a time in submission order; tasks for
 * different keys run in parallel. Everything that mutates a position (ledger,
 * DCA, exit state machine, drift reconciler) runs as a task here, so position
 * state needs no locks.
 *
 * <p>A task must never block on another task's future for the same key: the
 * second task cannot start until the first returns.
 */
@Component
public class PositionEventLoop {

    private static final Logger log = LoggerFactory.getLogger(PositionEventLoop.class);

    /** Tasks drained per turn before the key yields its worker thread. */
    private static final int MAX_BATCH = 64;

    private final Executor executor;
    private final Map<PositionKey, KeyQueue> queues = new ConcurrentHashMap<>();

    public PositionEventLoop(@Qualifier("positionLoopExecutor") Executor executor) {
        this.executor = executor;
    }

    public <T> CompletableFuture<T> submit(PositionKey key, Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        enqueue(key, () -> {
            try {
                future.complete(task.call());
            } catch (Exception e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    public CompletableFuture<Void> execute(PositionKey key, Runnable task) {
        return submit(key, () -> {
            task.run();
            return null;
        });
    }

    /** Fire-and-forget variant; failures are logged. */
    public void post(PositionKey key, String description, Runnable task) {
        execute(key, task).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Loop task '{}' failed for {}: {}", description, key, error.getMessage(), error);
            }
        });
    }

    public int pendingTasks(PositionKey key) {
        KeyQueue queue = queues.get(key);
        return queue == null ? 0 : queue.tasks.size();
    }

    private void enqueue(PositionKey key, Runnable task) {
        KeyQueue queue = queues.computeIfAbsent(key, k -> new KeyQueue());
        queue.tasks.add(task);
        schedule(key, queue);
    }

    private void schedule(PositionKey key, KeyQueue queue) {
        if (queue.running.compareAndSet(false, true)) {
            executor.execute(() -> drain(key, queue));
        }
    }

    private void drain(PositionKey key, KeyQueue queue) {
        int processed = 0;
        try {
            Runnable task;
            while (processed < MAX_BATCH && (task = queue.tasks.poll()) != null) {
                processed++;
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Unhandled error in loop for {}: {}", key, e.getMessage(), e);
                }
            }
        } finally {
            queue.running.set(false);
        }
        if (!queue.tasks.isEmpty()) {
            schedule(key, queue);
        }
    }

    private static final class KeyQueue {
        private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean running = new AtomicBoolean();
    }
}
