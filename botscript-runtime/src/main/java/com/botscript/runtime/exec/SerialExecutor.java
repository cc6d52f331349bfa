package com.botscript.runtime.exec;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared
 * delegate executor.
 * <p>
 * Any thread may submit. At most one delegate thread drains the queue at any
 * moment, so tasks never overlap and each task sees the effects of every task
 * submitted before it. A drain pass runs at most {@link #BATCH_SIZE} tasks and
 * then yields the delegate thread, so one busy queue cannot starve others
 * sharing the same pool.
 */
@Slf4j
public class SerialExecutor implements Executor {

    static final int BATCH_SIZE = 64;

    private final String name;
    private final Executor delegate;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean();
    private volatile Thread runner;
    private volatile Consumer<RejectedExecutionException> onRejected;

    public SerialExecutor(String name, Executor delegate) {
        this.name = Objects.requireNonNull(name, "name");
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /**
     * Called when the delegate refuses to run a drain pass. Without a handler
     * the rejection propagates to the submitter.
     */
    public SerialExecutor setOnRejected(Consumer<RejectedExecutionException> onRejected) {
        this.onRejected = onRejected;
        return this;
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        tasks.add(task);
        schedule();
    }

    /** Whether the calling thread is currently draining this executor. */
    public boolean isCurrentThread() {
        return runner == Thread.currentThread();
    }

    /** Approximate number of queued tasks. */
    public int pending() {
        return tasks.size();
    }

    public String getName() {
        return name;
    }

    private void schedule() {
        if (!scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            delegate.execute(this::drain);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            Consumer<RejectedExecutionException> handler = onRejected;
            if (handler == null) {
                throw e;
            }
            handler.accept(e);
        }
    }

    private void drain() {
        runner = Thread.currentThread();
        try {
            int executed = 0;
            Runnable task;
            while (executed < BATCH_SIZE && (task = tasks.poll()) != null) {
                executed++;
                try {
                    task.run();
                } catch (Throwable t) {
                    log.error("[{}] task failed: {}", name, t.toString(), t);
                }
            }
        } finally {
            runner = null;
            scheduled.set(false);
        }
        if (!tasks.isEmpty()) {
            schedule();
        }
    }
}
