package com.example.filefinder;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared queue of directories waiting to be expanded.
 * <p>
 * Besides the FIFO itself the queue owns the pending count: the number of tasks that were
 * pushed but not yet completed, whether they are still queued or being expanded by a worker.
 * A pending count of zero is the only termination signal. An empty queue alone means nothing,
 * since another worker may be halfway through a directory and about to push more tasks.
 * <p>
 * The deque, the pending count and the stop flag are guarded by one lock, so a push and its
 * increment become visible together and a completion can never overtake a push.
 */
public final class WorkQueue {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<Path> tasks = new ArrayDeque<>();
    private long pending;
    private long pushed;
    private long completed;
    private boolean stopped;

    /**
     * Registers a new task and appends it. Wakes one waiting worker.
     */
    public void push(Path directory) {
        lock.lock();
        try {
            pending++;
            pushed++;
            tasks.addLast(directory);
            changed.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a task is available, every task has completed, or the queue was stopped.
     *
     * @return the oldest queued task, or empty when the walk is over (drained or stopped)
     */
    public Optional<Path> take() throws InterruptedException {
        lock.lock();
        try {
            while (!stopped && tasks.isEmpty() && pending > 0) {
                changed.await();
            }
            if (stopped || tasks.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(tasks.removeFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retires one task previously returned by {@link #take()}. The call that brings the pending
     * count to zero wakes every waiter, since each idle worker has to see the drain to exit.
     */
    public void completeOne() {
        lock.lock();
        try {
            if (pending == 0) {
                throw new IllegalStateException("completeOne() called with no pending task");
            }
            pending--;
            completed++;
            if (pending == 0) {
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the walk: current and future {@link #take()} calls return empty.
     */
    public void stop() {
        lock.lock();
        try {
            stopped = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isStopped() {
        lock.lock();
        try {
            return stopped;
        } finally {
            lock.unlock();
        }
    }

    public long pendingCount() {
        lock.lock();
        try {
            return pending;
        } finally {
            lock.unlock();
        }
    }

    public long pushedCount() {
        lock.lock();
        try {
            return pushed;
        } finally {
            lock.unlock();
        }
    }

    public long completedCount() {
        lock.lock();
        try {
            return completed;
        } finally {
            lock.unlock();
        }
    }

    public int queuedCount() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }
}
