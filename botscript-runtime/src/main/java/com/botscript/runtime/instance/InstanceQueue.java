package com.botscript.runtime.instance;

import com.botscript.runtime.exec.SerialExecutor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * The single-threaded execution queue of one instance. Every script callback
 * of the instance runs here, one at a time, in posting order.
 */
@Slf4j
public class InstanceQueue {

    private final String instanceId;
    private final SerialExecutor executor;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean failed = new AtomicBoolean();

    /**
     * @param onFatal called once if the dispatch pool refuses to run this
     *                queue; the queue accepts nothing afterwards
     */
    public InstanceQueue(String instanceId, Executor dispatchPool, Consumer<Throwable> onFatal) {
        this.instanceId = instanceId;
        this.executor = new SerialExecutor("instance-" + instanceId, dispatchPool);
        this.executor.setOnRejected(e -> {
            if (failed.compareAndSet(false, true)) {
                log.error("Instance {} cannot be scheduled on the dispatch pool: {}", instanceId, e.getMessage());
                onFatal.accept(e);
            }
        });
    }

    /**
     * Append a task. Returns false if the queue is closed or failed, in which
     * case the task never runs.
     */
    public boolean post(Runnable task) {
        if (closed.get() || failed.get()) {
            log.debug("Dropping task for {} instance {}", failed.get() ? "failed" : "closed", instanceId);
            return false;
        }
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            return false;
        }
        return !failed.get();
    }

    /** Completes once every task posted before this call has run. */
    public CompletableFuture<Void> flush() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (!post(() -> done.complete(null))) {
            done.completeExceptionally(new IllegalStateException("queue of instance " + instanceId + " is not accepting tasks"));
        }
        return done;
    }

    /** Whether the calling thread is the one currently running this queue. */
    public boolean isCurrentThread() {
        return executor.isCurrentThread();
    }

    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean isFailed() {
        return failed.get();
    }
}
